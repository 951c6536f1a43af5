package com.questrail.poolheat.cloud.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution for poll ticks, retry backoff and command deadlines.
 *
 * <h2>Binding invariant</h2>
 * Scheduling is expressed in monotonic ticks from {@link #clock()}, never in
 * wall-clock instants. Tests substitute a deterministic implementation whose
 * tasks run only when the test advances time.
 */
public interface MonotonicScheduler
{
    /**
     * The clock that deadlines passed to {@link #scheduleAtNanos} refer to.
     */
    MonotonicClock clock();

    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link #clock()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run once {@code delay} has elapsed.
     */
    default Cancellable scheduleAfter(Duration delay, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock().nowNanos() + delay.toNanos(), task);
    }
}
