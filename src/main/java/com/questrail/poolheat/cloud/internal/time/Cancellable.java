package com.questrail.poolheat.cloud.internal.time;

/**
 * Cancellation handle for a scheduled task (poll tick, retry, command deadline).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();

    /**
     * Handle for work that was never scheduled.
     */
    Cancellable NONE = () -> false;
}
