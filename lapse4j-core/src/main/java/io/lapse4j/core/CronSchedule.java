package io.lapse4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.lapse4j.utils.CronExpressions;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Cron-style schedule, either as individual fields or as a raw 5/6-field crontab {@code expression}.
 *
 * <p>Field semantics when given individually:
 * <ul>
 *   <li>fields more significant than the least significant given field default to {@code *}</li>
 *   <li>less significant fields default to their minimum (month/day 1, hour/minute/second 0)</li>
 *   <li>{@code week} (ISO week of year) and {@code day_of_week} always default to {@code *}</li>
 *   <li>{@code day_of_week} numbers count from Monday = 0; names (mon-sun) are accepted as well</li>
 * </ul>
 * A schedule with no field at all fires every second.
 */
public record CronSchedule(
        String expression,
        String year,
        String month,
        String day,
        String week,
        @JsonProperty("day_of_week") String dayOfWeek,
        String hour,
        String minute,
        String second,
        String timezone
) {

    private static final String[] FIELD_NAMES = {
            "year", "month", "day", "week", "day_of_week", "hour", "minute", "second"
    };
    private static final String[] FIELD_DEFAULTS = {"*", "1", "1", "*", "*", "0", "0", "0"};

    public CronSchedule {
        expression = blankToNull(expression);
        year = blankToNull(year);
        month = blankToNull(month);
        day = blankToNull(day);
        week = blankToNull(week);
        dayOfWeek = blankToNull(dayOfWeek);
        hour = blankToNull(hour);
        minute = blankToNull(minute);
        second = blankToNull(second);
        timezone = blankToNull(timezone);

        if (expression != null && hasFields(year, month, day, week, dayOfWeek, hour, minute, second)) {
            throw new IllegalArgumentException("Cron expression and individual fields are mutually exclusive");
        }
        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
            }
        }
    }

    /**
     * Schedule from a 5-field (minute precision) or 6-field (with seconds) crontab string.
     */
    public static CronSchedule parse(String expression) {
        if (!CronExpressions.looksLikeCron(expression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression);
        }
        return new CronSchedule(expression, null, null, null, null, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ZoneId zone() {
        return timezone != null ? ZoneId.of(timezone) : ZoneId.systemDefault();
    }

    /**
     * Field values after defaulting, in {@code year, month, day, week, day_of_week, hour, minute, second} order.
     * Raw expressions have no field view and return an empty map.
     */
    public Map<String, String> resolvedFields() {
        if (expression != null) {
            return Map.of();
        }
        String[] given = {year, month, day, week, dayOfWeek, hour, minute, second};
        int last = -1;
        for (int i = 0; i < given.length; i++) {
            if (given[i] != null) {
                last = i;
            }
        }

        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < given.length; i++) {
            String value;
            if (given[i] != null) {
                value = given[i];
            } else if (last >= 0 && i > last) {
                value = FIELD_DEFAULTS[i];
            } else {
                value = "*";
            }
            out.put(FIELD_NAMES[i], value);
        }
        return out;
    }

    /**
     * Quartz expression ({@code sec min hour dom month dow [year]}). The ISO week constraint is not part of it.
     */
    public String toQuartzExpression() {
        if (expression != null) {
            return CronExpressions.normalizeCron(expression);
        }
        Map<String, String> f = resolvedFields();
        String dom = f.get("day");
        String dow = CronExpressions.toQuartzDayOfWeek(f.get("day_of_week"));

        if ("?".equals(dow)) {
            if ("?".equals(dom)) {
                dom = "*";
            }
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            throw new IllegalArgumentException("day and day_of_week cannot both be restricted: day="
                    + dom + ", day_of_week=" + f.get("day_of_week"));
        }

        List<String> parts = new ArrayList<>(List.of(
                f.get("second"), f.get("minute"), f.get("hour"), dom, f.get("month").toUpperCase(), dow));
        String y = f.get("year");
        if (!"*".equals(y)) {
            parts.add(y);
        }
        return String.join(" ", parts);
    }

    /**
     * The {@code week} field, or {@code null} when every ISO week is allowed.
     */
    public String weekConstraint() {
        if (week == null || "*".equals(week)) {
            return null;
        }
        return week;
    }

    @Override
    public String toString() {
        if (expression != null) {
            return "cron[" + expression + (timezone != null ? ", timezone='" + timezone + "'" : "") + "]";
        }
        StringJoiner j = new StringJoiner(", ", "cron[", "]");
        String[] given = {year, month, day, week, dayOfWeek, hour, minute, second};
        for (int i = 0; i < given.length; i++) {
            if (given[i] != null) {
                j.add(FIELD_NAMES[i] + "='" + given[i] + "'");
            }
        }
        if (timezone != null) {
            j.add("timezone='" + timezone + "'");
        }
        return j.toString();
    }

    private static boolean hasFields(String... fields) {
        for (String f : fields) {
            if (f != null) {
                return true;
            }
        }
        return false;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static final class Builder {
        private String year;
        private String month;
        private String day;
        private String week;
        private String dayOfWeek;
        private String hour;
        private String minute;
        private String second;
        private String timezone;

        public Builder year(String year) {
            this.year = year;
            return this;
        }

        public Builder month(String month) {
            this.month = month;
            return this;
        }

        public Builder day(String day) {
            this.day = day;
            return this;
        }

        public Builder week(String week) {
            this.week = week;
            return this;
        }

        public Builder dayOfWeek(String dayOfWeek) {
            this.dayOfWeek = dayOfWeek;
            return this;
        }

        public Builder hour(String hour) {
            this.hour = hour;
            return this;
        }

        public Builder minute(String minute) {
            this.minute = minute;
            return this;
        }

        public Builder second(String second) {
            this.second = second;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public CronSchedule build() {
            return new CronSchedule(null, year, month, day, week, dayOfWeek, hour, minute, second, timezone);
        }
    }
}
