package io.lapse4j.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Workers check it between items; setting it never interrupts an item in flight.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation.
     *
     * @return true if this call flipped the flag, false if it was already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken(cancelled=" + cancelled.get() + ")";
    }
}
