package io.lapse4j.internal;

import io.lapse4j.core.CronSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuartzFireTimeEvaluatorTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void nextFireTimeShouldIncludeTheProbeInstant() {
        QuartzFireTimeEvaluator noon = QuartzFireTimeEvaluator.of(
                CronSchedule.builder().hour("12").timezone("UTC").build());
        ZonedDateTime at = ZonedDateTime.of(2024, 5, 1, 12, 0, 0, 0, UTC);

        assertEquals(at, noon.nextFireTime(at));
        assertEquals(at.plusDays(1), noon.nextFireTime(at.plusNanos(1_000_000)));
    }

    @Test
    void weekFieldShouldSkipToAllowedIsoWeek() {
        QuartzFireTimeEvaluator secondWeek = QuartzFireTimeEvaluator.of(
                CronSchedule.builder().week("2").hour("0").timezone("UTC").build());

        ZonedDateTime next = secondWeek.nextFireTime(ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, UTC));

        assertEquals(ZonedDateTime.of(2024, 1, 8, 0, 0, 0, 0, UTC), next);
    }

    @Test
    void pastYearShouldNeverFire() {
        QuartzFireTimeEvaluator y2020 = QuartzFireTimeEvaluator.of(
                CronSchedule.builder().year("2020").timezone("UTC").build());

        assertNull(y2020.nextFireTime(ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, UTC)));
    }

    @Test
    void fireTimesShouldFollowScheduleTimezone() {
        QuartzFireTimeEvaluator berlinNoon = QuartzFireTimeEvaluator.of(
                CronSchedule.builder().hour("12").timezone("Europe/Berlin").build());

        ZonedDateTime next = berlinNoon.nextFireTime(ZonedDateTime.of(2024, 7, 1, 0, 0, 0, 0, UTC));

        assertEquals(Instant.parse("2024-07-01T10:00:00Z"), next.toInstant());
        assertEquals(ZoneId.of("Europe/Berlin"), next.getZone());
    }

    @Test
    void invalidFieldShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> QuartzFireTimeEvaluator.of(CronSchedule.builder().hour("25").build()));
    }
}
