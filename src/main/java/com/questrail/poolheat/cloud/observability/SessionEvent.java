package com.questrail.poolheat.cloud.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a session lifecycle event. Never carries tokens or secrets.
 */
public record SessionEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        LOGGED_IN,
        REFRESHED,
        INVALIDATED,
        AUTH_FAILED
    }

    public SessionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
