package io.lapse4j.config;

import io.lapse4j.task.TaskManager;
import org.springframework.context.SmartLifecycle;

/**
 * Cancels running background tasks when the Spring container stops.
 */
public class TaskManagerLifecycle implements SmartLifecycle {
    private final TaskManager taskManager;
    private volatile boolean running = false;

    public TaskManagerLifecycle(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        taskManager.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
