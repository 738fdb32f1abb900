package io.lapse4j.task;

import io.lapse4j.ProgressCallback;
import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.ExecutionCancelledException;

/**
 * Handle given to a running {@link io.lapse4j.TaskJob}: progress sink plus the task's cancellation token.
 */
public final class TaskContext {

    private final BackgroundTask<?> task;

    TaskContext(BackgroundTask<?> task) {
        this.task = task;
    }

    public String taskId() {
        return task.id();
    }

    /**
     * Updates the task's {@code current/total/message/progressPercent}.
     */
    public ProgressCallback progress() {
        return task::updateProgress;
    }

    public CancellationToken cancellationToken() {
        return task.cancellationToken();
    }

    public boolean isCancelled() {
        return task.cancellationToken().isCancelled();
    }

    /**
     * Checkpoint for jobs that do not go through the executor.
     *
     * @throws ExecutionCancelledException if cancellation was requested
     */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new ExecutionCancelledException(task.current(), task.total());
        }
    }
}
