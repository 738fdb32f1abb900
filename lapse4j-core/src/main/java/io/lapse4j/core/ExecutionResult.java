package io.lapse4j.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one parallel run.
 *
 * <p>Results are in completion order. A cancelled run keeps the results that finished before the pool was
 * torn down; a failed run carries the {@link TransformException}.
 */
public record ExecutionResult<R>(
        ExecutionOutcome outcome,
        List<R> results,
        int completed,
        int total,
        TransformException failure
) {

    public ExecutionResult {
        // transforms may legitimately return null
        results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public static <R> ExecutionResult<R> completed(List<R> results, int total) {
        return new ExecutionResult<>(ExecutionOutcome.COMPLETED, results, total, total, null);
    }

    public static <R> ExecutionResult<R> cancelled(List<R> results, int completed, int total) {
        return new ExecutionResult<>(ExecutionOutcome.CANCELLED, results, completed, total, null);
    }

    public static <R> ExecutionResult<R> failed(List<R> results, int completed, int total, TransformException failure) {
        return new ExecutionResult<>(ExecutionOutcome.FAILED, results, completed, total, failure);
    }

    public boolean isCompleted() {
        return outcome == ExecutionOutcome.COMPLETED;
    }

    public boolean isCancelled() {
        return outcome == ExecutionOutcome.CANCELLED;
    }

    public boolean isFailed() {
        return outcome == ExecutionOutcome.FAILED;
    }

    /**
     * Results of a completed run; otherwise throws the failure or an {@link ExecutionCancelledException}.
     */
    public List<R> orThrow() {
        return switch (outcome) {
            case COMPLETED -> results;
            case CANCELLED -> throw new ExecutionCancelledException(completed, total);
            case FAILED -> throw failure;
        };
    }
}
