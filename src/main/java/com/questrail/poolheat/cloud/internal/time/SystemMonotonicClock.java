package com.questrail.poolheat.cloud.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP, DST or manual wall-clock changes, so a session
 * expiry or command deadline can never be skipped or doubled by a clock jump.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
