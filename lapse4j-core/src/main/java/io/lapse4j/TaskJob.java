package io.lapse4j;

import io.lapse4j.task.TaskContext;

/**
 * A whole job run by a background task. Implementations report progress through
 * {@link TaskContext#progress()} and pass {@link TaskContext#cancellationToken()} on to the executor.
 */
@FunctionalInterface
public interface TaskJob<R> {
    R run(TaskContext context) throws Exception;
}
