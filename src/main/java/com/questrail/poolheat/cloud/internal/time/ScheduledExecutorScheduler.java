package com.questrail.poolheat.cloud.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Deadlines are converted to relative delays at scheduling time using the
 * same {@link MonotonicClock} callers used to compute them. Tasks may run
 * slightly after their deadline, never before.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. The runtime that
 * created it shuts it down.</p>
 *
 * <h2>Shutdown</h2>
 * <p>Scheduling against a terminated executor is not an error: the task is
 * dropped and {@link Cancellable#NONE} is returned, since shutdown already
 * cancels all timed work.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            if (executor.isShutdown()) {
                return Cancellable.NONE;
            }
            throw e;
        }

        // mayInterruptIfRunning=false: an executing poll or send finishes on its own
        return () -> future.cancel(false);
    }
}
