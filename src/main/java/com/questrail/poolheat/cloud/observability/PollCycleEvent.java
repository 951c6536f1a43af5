package com.questrail.poolheat.cloud.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a poll cycle milestone.
 *
 * <p>{@code deviceCount} is the number of devices the cycle covered;
 * {@code consecutiveFailures} the number of cycles abandoned in a row,
 * including this one when {@code kind} is {@link Kind#CYCLE_ABANDONED}.</p>
 */
public record PollCycleEvent(
    Instant timestamp,
    Kind kind,
    int deviceCount,
    int consecutiveFailures,
    String detail
) {
    public enum Kind {
        DISCOVERY_COMPLETED,
        CYCLE_COMPLETED,
        CYCLE_ABANDONED,
        DEVICE_FAILED,
        DEVICES_UNAVAILABLE
    }

    public PollCycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
