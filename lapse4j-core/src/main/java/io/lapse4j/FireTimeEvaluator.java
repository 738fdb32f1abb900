package io.lapse4j;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron-evaluation capability consumed by the cron selector.
 */
public interface FireTimeEvaluator {

    /**
     * Returns the earliest fire time at or after {@code after}, or {@code null} if the schedule never fires again.
     */
    ZonedDateTime nextFireTime(ZonedDateTime after);

    /**
     * Zone in which calendar days are evaluated.
     */
    ZoneId zone();
}
