package io.lapse4j.internal;

import io.lapse4j.FireTimeEvaluator;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.utils.CronExpressions;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Date;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * {@link FireTimeEvaluator} backed by a Quartz {@link CronExpression}.
 *
 * <p>Quartz only answers "strictly after, at second precision". Asking for the next time after
 * {@code t - 1ms} turns that into "at or after {@code t}". The ISO week field has no Quartz
 * counterpart and is applied as a filter on top.
 */
public class QuartzFireTimeEvaluator implements FireTimeEvaluator {

    // ~ 10 years of weekly skips before giving up on a week filter that never matches
    private static final int MAX_WEEK_SKIPS = 530;

    private final CronExpression expression;
    private final ZoneId zone;
    private final Set<Integer> allowedWeeks;

    public QuartzFireTimeEvaluator(CronSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        this.zone = schedule.zone();
        this.expression = compile(schedule.toQuartzExpression(), zone);
        String week = schedule.weekConstraint();
        this.allowedWeeks = week == null ? null : CronExpressions.parseWeekField(week);
    }

    public static QuartzFireTimeEvaluator of(CronSchedule schedule) {
        return new QuartzFireTimeEvaluator(schedule);
    }

    @Override
    public ZonedDateTime nextFireTime(ZonedDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        ZonedDateTime from = after.withZoneSameInstant(zone);

        for (int skips = 0; skips <= MAX_WEEK_SKIPS; skips++) {
            ZonedDateTime next = atOrAfter(from);
            if (next == null) {
                return null;
            }
            if (allowedWeeks == null || allowedWeeks.contains(next.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))) {
                return next;
            }
            from = next.toLocalDate()
                    .with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                    .atTime(LocalTime.MIDNIGHT)
                    .atZone(zone);
        }
        return null;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    public String expression() {
        return expression.getCronExpression();
    }

    private ZonedDateTime atOrAfter(ZonedDateTime from) {
        Date probe = new Date(from.toInstant().toEpochMilli() - 1);
        Date next = expression.getNextValidTimeAfter(probe);
        return next == null ? null : ZonedDateTime.ofInstant(next.toInstant(), zone);
    }

    private static CronExpression compile(String cron, ZoneId zone) {
        if (!CronExpression.isValidExpression(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
    }

    @Override
    public String toString() {
        return "QuartzFireTimeEvaluator[" + expression.getCronExpression() + ", zone=" + zone
                + (allowedWeeks != null ? ", weeks=" + allowedWeeks : "") + "]";
    }
}
