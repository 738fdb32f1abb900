package io.lapse4j.core;

/**
 * Thrown by the throwing executor API when a run stopped because of a cancellation request.
 */
public class ExecutionCancelledException extends RuntimeException {

    private final int completed;
    private final int total;

    public ExecutionCancelledException(int completed, int total) {
        super("execution cancelled after " + completed + "/" + total + " items");
        this.completed = completed;
        this.total = total;
    }

    public int completed() {
        return completed;
    }

    public int total() {
        return total;
    }
}
