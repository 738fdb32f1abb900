package io.lapse4j.select;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Common hour and minute lists for {@link FixedWindowSelector}.
 */
public final class TimeSpans {

    public static final List<Integer> NIGHT_HOURS = List.of(21, 22, 23, 0, 1, 2, 3, 4, 5);
    public static final List<Integer> DAWN_TO_DUSK = range(6, 21, 1);
    public static final List<Integer> EVERY_DAY_HOUR = range(6, 20, 1);
    public static final List<Integer> EVERY_TWO_HOURS = range(0, 24, 2);
    public static final List<Integer> EVERY_DAY_TWO_HOURS = List.of(8, 10, 12, 14, 16, 20);

    public static final List<Integer> EVERY_TEN_MINUTES = range(0, 51, 10);
    public static final List<Integer> EVERY_FIVE_MINUTES = range(0, 56, 5);
    public static final List<Integer> EVERY_TWO_MINUTES = range(0, 59, 2);
    public static final List<Integer> FIFTEEN_MINUTES = List.of(0, 15, 30, 45);

    private TimeSpans() {
    }

    private static List<Integer> range(int fromInclusive, int toExclusive, int step) {
        return IntStream.iterate(fromInclusive, i -> i < toExclusive, i -> i + step)
                .boxed()
                .collect(Collectors.toUnmodifiableList());
    }
}
