package io.lapse4j.utils;

import org.quartz.CronExpression;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Helpers for turning schedule text into Quartz {@link CronExpression}s.
 * <p>
 * Supported input:
 * <ul>
 *   <li>5-field crontab ({@code min hour dom month dow}); seconds default to "0"</li>
 *   <li>6-field crontab with leading seconds</li>
 *   <li>anything else is passed through and must already be a Quartz expression</li>
 * </ul>
 */
public final class CronExpressions {

    private static final String[] WEEKDAYS = {"MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};
    private static final String[] CRONTAB_WEEKDAYS = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};

    private CronExpressions() {
    }

    /**
     * Normalize crontab strings to Quartz syntax:
     * - Accepts 6-field cron with seconds.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Numeric days of week use crontab numbering ({@code 0} and {@code 7} = Sunday) and become names.
     *   Fields already carrying Quartz's {@code ?} are left as they are.
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;
        if (!"?".equals(dom) && !"?".equals(dow)) {
            dow = crontabDayOfWeek(dow);
        }

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else if ("*".equals(dow)) {
            dow = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String crontabDayOfWeek(String field) {
        if ("*".equals(field)) {
            return field;
        }
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            int slash = part.indexOf('/');
            String base = slash >= 0 ? part.substring(0, slash) : part;
            String[] range = base.split("-", -1);
            for (int i = 0; i < range.length; i++) {
                if (i > 0) {
                    out.append('-');
                }
                String token = range[i];
                // out-of-range numbers fall through and fail Quartz validation
                if (token.matches("[0-7]")) {
                    out.append(CRONTAB_WEEKDAYS[Integer.parseInt(token)]);
                } else {
                    out.append(token);
                }
            }
            if (slash >= 0) {
                out.append(part.substring(slash));
            }
        }
        return out.toString();
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String expression) {
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Translates a Monday-based day-of-week field ({@code 0 = mon}, names allowed) to Quartz syntax.
     * {@code *} becomes {@code ?}.
     */
    public static String toQuartzDayOfWeek(String field) {
        if (field == null || "*".equals(field.trim()) || "?".equals(field.trim())) {
            return "?";
        }
        StringBuilder out = new StringBuilder();
        for (String part : field.trim().split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            String base = part;
            String step = null;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                base = part.substring(0, slash);
                step = part.substring(slash + 1);
            }

            if ("*".equals(base)) {
                out.append("MON-SUN");
            } else {
                String[] range = base.split("-");
                if (range.length > 2) {
                    throw new IllegalArgumentException("Invalid day_of_week range: " + part);
                }
                out.append(weekdayName(range[0]));
                if (range.length == 2) {
                    out.append('-').append(weekdayName(range[1]));
                }
            }
            if (step != null) {
                out.append('/').append(step);
            }
        }
        return out.toString();
    }

    private static String weekdayName(String token) {
        String t = token.trim().toUpperCase(Locale.ROOT);
        if (t.matches("\\d+")) {
            int n = Integer.parseInt(t);
            if (n < 0 || n > 6) {
                throw new IllegalArgumentException("day_of_week out of range 0-6: " + token);
            }
            return WEEKDAYS[n];
        }
        for (String name : WEEKDAYS) {
            if (name.equals(t)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unsupported day_of_week value: " + token);
    }

    /**
     * Expands an ISO week-of-year field into the set of allowed weeks 1-53. Accepts {@code *}, single weeks,
     * ranges {@code a-b}, steps {@code a-b/s} or {@code n/s} (and a step after {@code *}), and comma lists.
     */
    public static Set<Integer> parseWeekField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("week field must not be blank");
        }
        Set<Integer> weeks = new TreeSet<>();
        for (String part : field.trim().split(",")) {
            String base = part.trim();
            int step = 1;
            int slash = base.indexOf('/');
            if (slash >= 0) {
                step = parseBounded(base.substring(slash + 1), 1, 53, "week step");
                base = base.substring(0, slash);
            }

            int from;
            int to;
            if ("*".equals(base)) {
                from = 1;
                to = 53;
            } else if (base.contains("-")) {
                String[] range = base.split("-", 2);
                from = parseBounded(range[0], 1, 53, "week");
                to = parseBounded(range[1], 1, 53, "week");
                if (from > to) {
                    throw new IllegalArgumentException("Invalid week range: " + part);
                }
            } else {
                from = parseBounded(base, 1, 53, "week");
                to = slash >= 0 ? 53 : from;
            }

            for (int w = from; w <= to; w += step) {
                weeks.add(w);
            }
        }
        return weeks;
    }

    private static int parseBounded(String s, int min, int max, String what) {
        int n;
        try {
            n = Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + what + ": " + s);
        }
        if (n < min || n > max) {
            throw new IllegalArgumentException(what + " out of range " + min + "-" + max + ": " + n);
        }
        return n;
    }
}
