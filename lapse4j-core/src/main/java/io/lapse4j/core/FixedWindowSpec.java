package io.lapse4j.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed hour/minute targets for the day-slice selector.
 *
 * <ul>
 *   <li>hours: 0-23, defaults to every hour</li>
 *   <li>minutes: 0-59, defaults to {@code [0]} (one sample per hour)</li>
 *   <li>fuzzyMinutes: max distance between a target minute and an actual one</li>
 * </ul>
 */
public record FixedWindowSpec(SortedSet<Integer> hours, SortedSet<Integer> minutes, int fuzzyMinutes) {

    public static final int DEFAULT_FUZZY_MINUTES = 5;

    private static final List<Integer> ALL_HOURS = IntStream.range(0, 24).boxed().collect(Collectors.toList());

    public FixedWindowSpec {
        hours = validated(hours, 23, "hour");
        minutes = validated(minutes, 59, "minute");
        if (fuzzyMinutes < 0) {
            throw new IllegalArgumentException("fuzzyMinutes must be non-negative: " + fuzzyMinutes);
        }
    }

    public static FixedWindowSpec defaults() {
        return of(null, null, null);
    }

    /**
     * Null or empty lists fall back to the defaults (all hours, minute 0, 5 minutes tolerance).
     */
    @JsonCreator
    public static FixedWindowSpec of(@JsonProperty("hourlist") Collection<Integer> hours,
                                     @JsonProperty("minutelist") Collection<Integer> minutes,
                                     @JsonProperty("fuzzy_minutes") Integer fuzzyMinutes) {
        return new FixedWindowSpec(
                new TreeSet<>(hours == null ? ALL_HOURS : hours),
                new TreeSet<>(minutes == null || minutes.isEmpty() ? List.of(0) : minutes),
                fuzzyMinutes == null ? DEFAULT_FUZZY_MINUTES : fuzzyMinutes);
    }

    private static SortedSet<Integer> validated(SortedSet<Integer> values, int max, String field) {
        if (values == null) {
            throw new IllegalArgumentException(field + " list must not be null");
        }
        SortedSet<Integer> out = new TreeSet<>();
        for (Integer v : values) {
            if (v == null || v < 0 || v > max) {
                throw new IllegalArgumentException(field + " out of range 0-" + max + ": " + v);
            }
            out.add(v);
        }
        return Collections.unmodifiableSortedSet(out);
    }
}
