package com.questrail.poolheat.cloud.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the synchronization engine.
 */
public record SyncErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
