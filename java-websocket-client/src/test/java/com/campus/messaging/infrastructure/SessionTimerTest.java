package com.campus.messaging.infrastructure;

import com.campus.messaging.support.ManualTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTimerTest {

    private final Object lock = new Object();
    private final AtomicLong epoch = new AtomicLong();
    private final AtomicInteger fired = new AtomicInteger();

    private ManualTaskScheduler scheduler;
    private SessionTimer timer;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        timer = new SessionTimer("test", scheduler, lock, epoch::get);
    }

    @Test
    void shouldFireOnceAfterDelay() {
        timer.arm(Duration.ofSeconds(1), fired::incrementAndGet);

        scheduler.advance(Duration.ofMillis(999));
        assertThat(fired).hasValue(0);
        assertThat(timer.isArmed()).isTrue();

        scheduler.advance(Duration.ofSeconds(5));
        assertThat(fired).hasValue(1);
        assertThat(timer.isArmed()).isFalse();
    }

    @Test
    void shouldReplacePreviousScheduleWhenRearmed() {
        timer.arm(Duration.ofSeconds(1), fired::incrementAndGet);
        timer.arm(Duration.ofSeconds(2), () -> fired.addAndGet(10));

        scheduler.advance(Duration.ofSeconds(3));

        assertThat(fired).hasValue(10);
    }

    @Test
    void shouldNotFireAfterCancel() {
        timer.arm(Duration.ofSeconds(1), fired::incrementAndGet);
        timer.cancel();

        scheduler.advance(Duration.ofSeconds(3));

        assertThat(fired).hasValue(0);
    }

    @Test
    void shouldIgnoreTimerFromEarlierEpoch() {
        timer.arm(Duration.ofSeconds(1), fired::incrementAndGet);
        epoch.incrementAndGet();

        scheduler.advance(Duration.ofSeconds(3));

        assertThat(fired).hasValue(0);
    }

    @Test
    void shouldSurviveFailingAction() {
        timer.arm(Duration.ofSeconds(1), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.advance(Duration.ofSeconds(1));

        timer.arm(Duration.ofSeconds(1), fired::incrementAndGet);
        scheduler.advance(Duration.ofSeconds(1));

        assertThat(fired).hasValue(1);
    }
}
