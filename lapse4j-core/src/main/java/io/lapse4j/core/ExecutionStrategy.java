package io.lapse4j.core;

public enum ExecutionStrategy {
    /**
     * One future per item on {@code workers * threadMultiplier} threads. Suited to I/O-bound transforms.
     */
    THREADED,
    /**
     * Items grouped into chunks processed sequentially by {@code workers} threads, with a shared per-item
     * progress counter polled on a fixed interval. Suited to CPU-bound transforms over large item counts.
     */
    CHUNKED
}
