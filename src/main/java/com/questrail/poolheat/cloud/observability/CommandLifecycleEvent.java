package com.questrail.poolheat.cloud.observability;

import com.questrail.poolheat.api.CommandId;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing one step in a command's lifecycle.
 */
public record CommandLifecycleEvent(
    Instant timestamp,
    CommandId commandId,
    DeviceId deviceId,
    DeviceField field,
    FieldValue value,
    Kind kind,
    int attempt,
    String detail
) {
    public enum Kind {
        ISSUED,
        SEND_ATTEMPT,
        ACCEPTED,
        RETRY_SCHEDULED,
        CONFIRMED,
        FAILED,
        EXPIRED
    }

    public CommandLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
