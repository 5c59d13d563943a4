package com.questrail.bacnet.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Runs a task once a monotonic deadline has passed. The transport uses it for
 * APDU timeout and retry timers; tests substitute a deterministic scheduler
 * that only fires when the test advances time.
 */
public interface MonotonicScheduler
{
    /**
     * @param deadlineNanos deadline on the {@link MonotonicClock} timeline
     * @param task          task to run at or after the deadline
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
