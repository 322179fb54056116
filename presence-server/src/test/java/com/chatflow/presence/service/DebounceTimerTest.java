package com.chatflow.presence.service;

import com.chatflow.presence.support.ManualTimerScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DebounceTimerTest {

    private static final Duration WINDOW = Duration.ofSeconds(3);

    private ManualTimerScheduler scheduler;
    private AtomicInteger fired;
    private DebounceTimer timer;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTimerScheduler();
        fired = new AtomicInteger();
        timer = new DebounceTimer(scheduler, WINDOW, fired::incrementAndGet);
    }

    @Test
    void firesOnceAfterTheWindow() {
        assertThat(timer.start()).isTrue();

        scheduler.advance(Duration.ofMillis(2999));
        assertThat(fired.get()).isZero();

        scheduler.advance(Duration.ofMillis(1));
        assertThat(fired.get()).isEqualTo(1);
        assertThat(timer.isPending()).isFalse();

        scheduler.advance(Duration.ofSeconds(10));
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void startWhilePendingDoesNotRearm() {
        timer.start();
        scheduler.advance(Duration.ofSeconds(2));

        assertThat(timer.start()).isFalse();

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void resetPushesTheExpiryBack() {
        timer.start();
        scheduler.advance(Duration.ofSeconds(2));

        timer.reset();
        scheduler.advance(Duration.ofSeconds(2));
        assertThat(fired.get()).isZero();
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void cancelPreventsFiring() {
        timer.start();

        assertThat(timer.cancel()).isTrue();
        assertThat(timer.cancel()).isFalse();

        scheduler.advance(Duration.ofSeconds(5));
        assertThat(fired.get()).isZero();
    }

    @Test
    void expiryWhoseCancelLostTheRaceIsIgnored() {
        // scheduler whose cancel never succeeds, like a task already dequeued by the loop
        ManualTimerScheduler delegate = new ManualTimerScheduler();
        TimerScheduler uncancellable = (task, delay) -> {
            delegate.schedule(task, delay);
            return () -> false;
        };
        DebounceTimer racy = new DebounceTimer(uncancellable, WINDOW, fired::incrementAndGet);

        racy.start();
        delegate.advance(Duration.ofSeconds(1));
        racy.reset();
        delegate.advance(Duration.ofSeconds(2));

        assertThat(fired.get()).isZero();

        delegate.advance(Duration.ofSeconds(1));
        assertThat(fired.get()).isEqualTo(1);
    }
}
