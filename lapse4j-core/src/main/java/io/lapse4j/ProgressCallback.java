package io.lapse4j;

/**
 * Receives progress updates as {@code (completed, total, message)}.
 *
 * <p>{@code total == 0} means indeterminate progress (e.g. while scanning a directory).
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (completed, total, message) -> {
    };

    void onProgress(int completed, int total, String message);

    static ProgressCallback orNoop(ProgressCallback callback) {
        return callback != null ? callback : NOOP;
    }
}
