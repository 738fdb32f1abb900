package io.lapse4j.select;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * "Closest value within tolerance" lookup shared by the selectors.
 */
public final class NearestValueMatcher {

    private NearestValueMatcher() {
    }

    /**
     * A matched value and its position in the searched sequence.
     */
    public record Match(int value, int index) {
    }

    /**
     * Finds the value in {@code values} closest to {@code target}.
     *
     * <p>On equal distance the earliest candidate in {@code values} wins, e.g. {@code nearest([5, 15], 10, 5)}
     * yields {@code (5, 0)}.
     *
     * @return the match, or empty if {@code values} is empty or the closest distance exceeds {@code tolerance}
     */
    public static Optional<Match> nearest(List<Integer> values, int target, int tolerance) {
        Objects.requireNonNull(values, "values must not be null");
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be non-negative: " + tolerance);
        }

        int bestIndex = -1;
        long bestDistance = Long.MAX_VALUE;
        for (int i = 0; i < values.size(); i++) {
            long distance = Math.abs((long) values.get(i) - target);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }

        if (bestIndex < 0 || bestDistance > tolerance) {
            return Optional.empty();
        }
        return Optional.of(new Match(values.get(bestIndex), bestIndex));
    }
}
