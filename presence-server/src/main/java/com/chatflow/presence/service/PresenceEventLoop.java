package com.chatflow.presence.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-threaded loop that runs every presence handler, typing expiry and health sweep
 * to completion, one at a time. Mutations made inside one task are therefore atomic with
 * respect to every other presence event.
 */
@Service
@Slf4j
public class PresenceEventLoop implements TimerScheduler {

    private ScheduledExecutorService executor;

    private final AtomicLong tasksExecuted = new AtomicLong(0);
    private final AtomicLong tasksFailed = new AtomicLong(0);

    @PostConstruct
    public void init() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence-loop");
            t.setDaemon(true);
            return t;
        });
        log.info("Presence event loop started");
    }

    /**
     * Runs the task on the loop. Failures are logged and never stop the loop.
     */
    public void execute(String label, Runnable task) {
        try {
            executor.execute(guard(label, task));
        } catch (RejectedExecutionException e) {
            log.warn("Presence loop is shut down, dropping task {}", label);
        }
    }

    /**
     * Runs the task on the loop and completes the returned future with its result.
     */
    public <T> CompletableFuture<T> submit(String label, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.get());
                    tasksExecuted.incrementAndGet();
                } catch (Exception e) {
                    tasksFailed.incrementAndGet();
                    log.error("Presence task {} failed: {}", label, e.getMessage(), e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guard("timer", task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    public ScheduledTask scheduleAtFixedRate(String label, Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guard(label, task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    private Runnable guard(String label, Runnable task) {
        return () -> {
            try {
                task.run();
                tasksExecuted.incrementAndGet();
            } catch (Exception e) {
                tasksFailed.incrementAndGet();
                log.error("Presence task {} failed: {}", label, e.getMessage(), e);
            }
        };
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down presence event loop...");
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Presence event loop stopped");
    }

    public long getTasksExecuted() {
        return tasksExecuted.get();
    }

    public long getTasksFailed() {
        return tasksFailed.get();
    }
}
