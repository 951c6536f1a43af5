package com.questrail.poolheat.cloud.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every correctness decision in the engine: session expiry,
 * poll cadence, retry backoff and command deadlines.
 *
 * <h2>Binding invariant</h2>
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for values
 * handed to observers for display. Anything compared against a deadline uses
 * this clock.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
