package io.lapse4j.task;

import io.lapse4j.core.ExecutionStrategy;
import io.lapse4j.core.TaskStatus;
import io.lapse4j.exec.ExecutorSettings;
import io.lapse4j.exec.ParallelExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private final TaskManager manager = new TaskManager(Duration.ofSeconds(2));
    private final ParallelExecutor executor = new ParallelExecutor(ExecutorSettings.builder()
            .workers(2)
            .pollInterval(Duration.ofMillis(20))
            .build());

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void completedTaskShouldExposeResultAndProgress() throws InterruptedException {
        List<Integer> items = IntStream.range(0, 50).boxed().collect(Collectors.toList());

        BackgroundTask<List<Integer>> task = manager.submit("double", ctx ->
                executor.run((item, idx) -> item * 2, items, ExecutionStrategy.CHUNKED,
                        ctx.progress(), ctx.cancellationToken()));

        assertTrue(task.await(WAIT));
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(50, task.result().orElseThrow().size());
        assertEquals(100.0, task.progressPercent());
        assertTrue(task.startedAt().isPresent());
        assertTrue(task.id().matches("[0-9a-f]{12}"));
    }

    @Test
    void cancelShouldStopRunningTaskWithoutCompletingIt() throws InterruptedException {
        List<Integer> items = IntStream.range(0, 2000).boxed().collect(Collectors.toList());

        BackgroundTask<List<Integer>> task = manager.submit("slow", ctx ->
                executor.run((item, idx) -> {
                    Thread.sleep(10);
                    return item;
                }, items, ExecutionStrategy.THREADED, ctx.progress(), ctx.cancellationToken()));

        long deadline = System.nanoTime() + WAIT.toNanos();
        while (task.current() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(manager.cancel(task.id()));

        assertTrue(task.await(Duration.ofSeconds(2)));
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertTrue(task.result().isEmpty());
        assertTrue(task.current() < items.size());
    }

    @Test
    void failingTransformShouldMarkTaskFailed() throws InterruptedException {
        BackgroundTask<List<Integer>> task = manager.submit("broken", ctx ->
                executor.run((item, idx) -> {
                    if (item == 3) {
                        throw new IllegalStateException("corrupt frame");
                    }
                    return item;
                }, List.of(1, 2, 3, 4), ExecutionStrategy.THREADED, ctx.progress(), ctx.cancellationToken()));

        assertTrue(task.await(WAIT));
        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().orElseThrow().contains("corrupt frame"));
        assertTrue(task.result().isEmpty());
    }

    @Test
    void jobCheckpointShouldHonourCancellation() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        BackgroundTask<String> task = manager.submit("checkpoint", ctx -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            ctx.checkCancelled();
            return "finished";
        });

        assertTrue(started.await(10, TimeUnit.SECONDS));
        assertTrue(task.cancel());
        release.countDown();

        assertTrue(task.await(WAIT));
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertFalse(task.cancel());
    }

    @Test
    void registryShouldTrackTasksInSubmissionOrder() throws InterruptedException {
        BackgroundTask<String> first = manager.submit("first", ctx -> "a");
        BackgroundTask<String> second = manager.submit("second", ctx -> "b");
        assertTrue(first.await(WAIT));
        assertTrue(second.await(WAIT));

        assertNotEquals(first.id(), second.id());
        assertEquals(List.of(first, second), manager.list());
        assertEquals(first, manager.get(first.id()).orElseThrow());
        assertTrue(manager.active().isEmpty());
        assertEquals("completed", manager.snapshots().get(0).status());
        assertFalse(manager.cancel("unknown"));

        assertEquals(2, manager.purgeFinished());
        assertTrue(manager.list().isEmpty());
    }

    @Test
    void shutdownShouldCancelActiveTasksAndRejectNewOnes() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        BackgroundTask<String> task = manager.submit("waiting", ctx -> {
            started.countDown();
            while (!ctx.isCancelled()) {
                Thread.sleep(5);
            }
            return "stopped";
        });
        assertTrue(started.await(10, TimeUnit.SECONDS));

        manager.shutdown();

        assertTrue(task.await(WAIT));
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertTrue(manager.isShutdown());
        assertThrows(IllegalStateException.class, () -> manager.submit("late", ctx -> "x"));
    }
}
