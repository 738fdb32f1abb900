package io.lapse4j.task;

import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.TaskStatus;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One submitted job, observable while it runs.
 *
 * <p>State machine: {@code PENDING -> RUNNING -> {COMPLETED, FAILED, CANCELLED}}. A pending task can also be
 * cancelled directly. Terminal states are final. Only the task's own worker thread and {@link #cancel()} mutate
 * it; callers poll the getters.
 */
public final class BackgroundTask<R> {

    private final String id;
    private final String name;
    private final Instant createdAt;
    private final CancellationToken token = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int current;
    private volatile int total;
    private volatile String message = "";
    private volatile double progressPercent;
    private volatile R result;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    BackgroundTask(String id, String name) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public TaskStatus status() {
        return status;
    }

    public int current() {
        return current;
    }

    public int total() {
        return total;
    }

    public String message() {
        return message;
    }

    public double progressPercent() {
        return progressPercent;
    }

    /**
     * Job return value; present only once the task completed.
     */
    public Optional<R> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Failure text (stack trace of the job's exception); present only for failed tasks.
     */
    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> completedAt() {
        return Optional.ofNullable(completedAt);
    }

    public boolean isDone() {
        return status.isTerminal();
    }

    /**
     * Requests cooperative cancellation. A pending task is cancelled immediately; a running one becomes
     * {@code CANCELLED} once its job reaches the next checkpoint.
     *
     * @return false if the task had already finished
     */
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        token.cancel();
        if (status == TaskStatus.PENDING) {
            terminate(TaskStatus.CANCELLED);
        }
        return true;
    }

    public boolean isCancellationRequested() {
        return token.isCancelled();
    }

    /**
     * Waits until the task reaches a terminal state.
     *
     * @return true if it did within {@code timeout}
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CancellationToken cancellationToken() {
        return token;
    }

    synchronized boolean markRunning() {
        if (status != TaskStatus.PENDING) {
            return false;
        }
        startedAt = Instant.now();
        status = TaskStatus.RUNNING;
        return true;
    }

    void updateProgress(int completed, int total, String message) {
        if (status.isTerminal()) {
            return;
        }
        this.current = completed;
        this.total = total;
        this.message = message == null ? "" : message;
        this.progressPercent = total > 0 ? completed * 100.0 / total : 0.0;
    }

    synchronized void complete(R value) {
        if (status.isTerminal()) {
            return;
        }
        result = value;
        progressPercent = 100.0;
        terminate(TaskStatus.COMPLETED);
    }

    synchronized void fail(Throwable failure) {
        if (status.isTerminal()) {
            return;
        }
        error = stackTraceOf(failure);
        terminate(TaskStatus.FAILED);
    }

    synchronized void markCancelled() {
        if (status.isTerminal()) {
            return;
        }
        result = null;
        terminate(TaskStatus.CANCELLED);
    }

    private void terminate(TaskStatus terminal) {
        completedAt = Instant.now();
        status = terminal;
        finished.countDown();
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    @Override
    public String toString() {
        return "BackgroundTask(id=" + id + ", name=" + name + ", status=" + status.wireName()
                + ", progress=" + current + "/" + total + ")";
    }
}
