package io.lapse4j.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link ParallelExecutor}.
 *
 * <ul>
 *   <li>workers: base worker count; CHUNKED uses it as pool size</li>
 *   <li>threadMultiplier: THREADED pool size is {@code workers * threadMultiplier}</li>
 *   <li>chunksPerWorker: CHUNKED chunk size is {@code ceil(total / (workers * chunksPerWorker))}</li>
 *   <li>pollInterval: bounded wait between progress/cancellation checks</li>
 *   <li>debug: run synchronously and log the first {@code debugSampleSize} results</li>
 * </ul>
 */
public record ExecutorSettings(
        int workers,
        int threadMultiplier,
        int chunksPerWorker,
        Duration pollInterval,
        boolean debug,
        int debugSampleSize
) {

    public static final int DEFAULT_THREAD_MULTIPLIER = 5;
    public static final int DEFAULT_CHUNKS_PER_WORKER = 4;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);
    public static final int DEFAULT_DEBUG_SAMPLE_SIZE = 10;

    public ExecutorSettings {
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be a positive number: " + workers);
        }
        if (threadMultiplier < 1) {
            throw new IllegalArgumentException("threadMultiplier must be a positive number: " + threadMultiplier);
        }
        if (chunksPerWorker < 1) {
            throw new IllegalArgumentException("chunksPerWorker must be a positive number: " + chunksPerWorker);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        if (debugSampleSize < 0) {
            throw new IllegalArgumentException("debugSampleSize must be non-negative: " + debugSampleSize);
        }
    }

    public static ExecutorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int threadPoolSize() {
        return workers * threadMultiplier;
    }

    public int chunkSize(int total) {
        int chunks = workers * chunksPerWorker;
        return Math.max(1, (total + chunks - 1) / chunks);
    }

    public static final class Builder {
        private int workers = Runtime.getRuntime().availableProcessors();
        private int threadMultiplier = DEFAULT_THREAD_MULTIPLIER;
        private int chunksPerWorker = DEFAULT_CHUNKS_PER_WORKER;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private boolean debug = false;
        private int debugSampleSize = DEFAULT_DEBUG_SAMPLE_SIZE;

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder threadMultiplier(int threadMultiplier) {
            this.threadMultiplier = threadMultiplier;
            return this;
        }

        public Builder chunksPerWorker(int chunksPerWorker) {
            this.chunksPerWorker = chunksPerWorker;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder debugSampleSize(int debugSampleSize) {
            this.debugSampleSize = debugSampleSize;
            return this;
        }

        public ExecutorSettings build() {
            return new ExecutorSettings(workers, threadMultiplier, chunksPerWorker, pollInterval, debug, debugSampleSize);
        }
    }
}
