package com.chatflow.presence.service;

import java.time.Duration;

/**
 * Single-shot timer that can be started, reset and cancelled. A reset cancels the
 * pending expiry before arming a new one, so only the latest arming can fire.
 */
public class DebounceTimer {

    private final TimerScheduler scheduler;
    private final Duration window;
    private final Runnable onExpire;

    private TimerScheduler.ScheduledTask pending;
    private Object generation;

    public DebounceTimer(TimerScheduler scheduler, Duration window, Runnable onExpire) {
        this.scheduler = scheduler;
        this.window = window;
        this.onExpire = onExpire;
    }

    /**
     * Arms the timer if it is idle.
     *
     * @return false if it was already pending
     */
    public synchronized boolean start() {
        if (pending != null) {
            return false;
        }
        arm();
        return true;
    }

    public synchronized void reset() {
        cancelPending();
        arm();
    }

    /**
     * @return true if an expiry was pending
     */
    public synchronized boolean cancel() {
        return cancelPending();
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    public Duration getWindow() {
        return window;
    }

    private void arm() {
        Object token = new Object();
        generation = token;
        pending = scheduler.schedule(() -> fire(token), window);
    }

    private boolean cancelPending() {
        if (pending == null) {
            return false;
        }
        pending.cancel();
        pending = null;
        generation = null;
        return true;
    }

    private void fire(Object token) {
        synchronized (this) {
            if (generation != token) {
                return; // superseded by a reset or cancel
            }
            pending = null;
            generation = null;
        }
        onExpire.run();
    }
}
