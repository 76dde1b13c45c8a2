package com.campus.messaging.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.function.LongSupplier;

/**
 * A named, independently cancellable one-shot timer owned by a session.
 *
 * {@link #arm} and {@link #cancel} must be called while holding the session
 * monitor. The action runs under the same monitor and only if the timer was not
 * re-armed or cancelled meanwhile and the session epoch is unchanged.
 */
@Slf4j
public class SessionTimer {

    private final String name;
    private final TaskScheduler scheduler;
    private final Object lock;
    private final LongSupplier epochSource;

    private ScheduledFuture<?> future;
    private long generation;

    public SessionTimer(String name, TaskScheduler scheduler, Object lock, LongSupplier epochSource) {
        this.name = name;
        this.scheduler = scheduler;
        this.lock = lock;
        this.epochSource = epochSource;
    }

    public void arm(Duration delay, Runnable action) {
        cancel();
        long armedGeneration = generation;
        long armedEpoch = epochSource.getAsLong();
        future = scheduler.schedule(
            () -> fire(armedGeneration, armedEpoch, action),
            scheduler.getClock().instant().plus(delay));
    }

    public void cancel() {
        generation++;
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    public boolean isArmed() {
        return future != null;
    }

    private void fire(long armedGeneration, long armedEpoch, Runnable action) {
        synchronized (lock) {
            if (armedGeneration != generation || armedEpoch != epochSource.getAsLong()) {
                log.trace("Stale timer ignored: timer={}", name);
                return;
            }
            future = null;
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Timer action failed: timer={}", name, e);
            }
        }
    }

    @Override
    public String toString() {
        return "SessionTimer{" + name + ", armed=" + isArmed() + "}";
    }
}
