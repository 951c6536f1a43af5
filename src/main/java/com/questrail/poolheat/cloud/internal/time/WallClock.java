package com.questrail.poolheat.cloud.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for timestamps shown to observers
 * ({@code DeviceState.updatedAt}, observability events).
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();

    WallClock SYSTEM = Instant::now;
}
