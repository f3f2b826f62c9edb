package com.meetbridge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * The bridge's single logical thread. Every handler that touches participant, track or
 * sending state is submitted here, so that state is never shared between threads.
 */
@Slf4j
public class BridgeEventLoop {

    private final Executor executor;
    private final TaskScheduler scheduler;

    public BridgeEventLoop(Executor executor, TaskScheduler scheduler) {
        this.executor = executor;
        this.scheduler = scheduler;
    }

    public void execute(String taskName, Runnable task) {
        executor.execute(() -> runGuarded(taskName, task));
    }

    /**
     * Run a read on the loop and hand the result back to the calling thread
     */
    public <T> CompletableFuture<T> call(String taskName, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(task.get());
            } catch (Exception e) {
                log.error("Event loop task '{}' failed", taskName, e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    public ScheduledFuture<?> schedule(String taskName, Runnable task, Duration delay) {
        return scheduler.schedule(() -> runGuarded(taskName, task), Instant.now().plus(delay));
    }

    public ScheduledFuture<?> scheduleAtFixedRate(String taskName, Runnable task, Duration period) {
        return scheduler.scheduleAtFixedRate(() -> runGuarded(taskName, task), period);
    }

    private void runGuarded(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Event loop task '{}' failed", taskName, e);
        }
    }
}
