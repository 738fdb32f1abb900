package io.lapse4j.exec;

import io.lapse4j.ProgressCallback;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared per-item counter that workers bump and a single collector publishes.
 *
 * <p>Workers only call {@link #increment()}; the collector calls {@link #publishIfChanged()} on its own
 * schedule, so progress granularity does not depend on how work is chunked.
 */
final class ProgressAggregator {

    private final AtomicInteger completed = new AtomicInteger();
    private final int total;
    private final ProgressCallback callback;
    private int lastReported;

    ProgressAggregator(int total, ProgressCallback callback) {
        this.total = total;
        this.callback = ProgressCallback.orNoop(callback);
    }

    void increment() {
        completed.incrementAndGet();
    }

    int completed() {
        return completed.get();
    }

    /**
     * Invokes the callback if the count moved since the last report. Collector thread only.
     *
     * @return true if the callback was invoked
     */
    boolean publishIfChanged() {
        int current = completed.get();
        if (current == lastReported) {
            return false;
        }
        lastReported = current;
        callback.onProgress(current, total, "");
        return true;
    }
}
