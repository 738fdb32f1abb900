package io.lapse4j.task;

import io.lapse4j.TaskJob;
import io.lapse4j.core.ExecutionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link TaskJob}s on their own worker threads and keeps track of them as {@link BackgroundTask}s.
 *
 * <p>Create one per application and pass it to whatever submits work; it is not a global.
 *
 * <pre>{@code
 * BackgroundTask<List<Path>> task = tasks.submit("export daily", ctx ->
 *         executor.run(transform, files, ExecutionStrategy.THREADED, ctx.progress(), ctx.cancellationToken()));
 *
 * tasks.cancel(task.id());
 * }</pre>
 */
public class TaskManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    private final Map<String, BackgroundTask<?>> tasks = new LinkedHashMap<>();
    private final Object lock = new Object();
    private final ExecutorService runner;
    private final Duration shutdownGrace;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public TaskManager() {
        this(Duration.ofSeconds(5));
    }

    /**
     * @param shutdownGrace how long {@link #shutdown()} waits for running tasks to reach a checkpoint
     */
    public TaskManager(Duration shutdownGrace) {
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
        AtomicInteger seq = new AtomicInteger();
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("lapse.task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers and starts a task. The returned task is {@code PENDING} until its thread picks it up.
     */
    public <R> BackgroundTask<R> submit(String name, TaskJob<R> job) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(job, "job must not be null");
        if (shutdown.get()) {
            throw new IllegalStateException("TaskManager has been shut down");
        }

        BackgroundTask<R> task = new BackgroundTask<>(newId(), name);
        synchronized (lock) {
            tasks.put(task.id(), task);
        }
        try {
            runner.execute(() -> runTask(task, job));
        } catch (RejectedExecutionException e) {
            task.fail(e);
            throw new IllegalStateException("TaskManager has been shut down", e);
        }
        log.debug("task submitted id={} name={}", task.id(), name);
        return task;
    }

    public Optional<BackgroundTask<?>> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(id));
        }
    }

    /**
     * All known tasks in submission order.
     */
    public List<BackgroundTask<?>> list() {
        synchronized (lock) {
            return new ArrayList<>(tasks.values());
        }
    }

    /**
     * Pending and running tasks.
     */
    public List<BackgroundTask<?>> active() {
        return list().stream().filter(t -> !t.isDone()).toList();
    }

    public List<TaskSnapshot> snapshots() {
        return list().stream().map(TaskSnapshot::of).toList();
    }

    /**
     * Requests cancellation of a task.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean cancel(String id) {
        return get(id).map(BackgroundTask::cancel).orElse(false);
    }

    /**
     * Forgets finished tasks.
     *
     * @return number of tasks removed
     */
    public int purgeFinished() {
        synchronized (lock) {
            int before = tasks.size();
            tasks.values().removeIf(BackgroundTask::isDone);
            return before - tasks.size();
        }
    }

    /**
     * Cancels active tasks and stops the worker threads. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<BackgroundTask<?>> active = active();
        log.info("TaskManager stopping, activeTasks={}", active.size());
        active.forEach(BackgroundTask::cancel);

        runner.shutdown();
        try {
            if (!runner.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                runner.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runner.shutdownNow();
        }
        log.info("TaskManager stopped.");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    private <R> void runTask(BackgroundTask<R> task, TaskJob<R> job) {
        if (!task.markRunning()) {
            log.debug("task cancelled before start id={} name={}", task.id(), task.name());
            return;
        }
        log.info("task started id={} name={}", task.id(), task.name());
        try {
            R result = job.run(new TaskContext(task));
            if (task.isCancellationRequested()) {
                task.markCancelled();
            } else {
                task.complete(result);
            }
        } catch (ExecutionCancelledException e) {
            task.markCancelled();
        } catch (Exception e) {
            log.error("task failed id={} name={} msg={}", task.id(), task.name(), e.getMessage(), e);
            task.fail(e);
        } catch (Error e) {
            log.error("task failed id={} name={} msg={}", task.id(), task.name(), e.getMessage(), e);
            task.fail(e);
            throw e;
        }
        log.info("task finished id={} name={} status={}", task.id(), task.name(), task.status().wireName());
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
