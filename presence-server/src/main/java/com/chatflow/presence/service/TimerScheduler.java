package com.chatflow.presence.service;

import java.time.Duration;

/**
 * Schedules single-shot tasks. Implemented by the presence event loop so that timer
 * callbacks run on the same thread as every other presence event.
 */
public interface TimerScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    @FunctionalInterface
    interface ScheduledTask {

        /**
         * @return true if the task was still pending and will not run
         */
        boolean cancel();
    }
}
