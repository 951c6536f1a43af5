package com.questrail.poolheat.cloud.internal.state;

import com.questrail.poolheat.api.CommandId;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FailureReason;
import com.questrail.poolheat.api.FieldValue;

import java.util.Objects;
import java.util.Optional;

/**
 * Emitted by the {@link StateStore} exactly once per command, at the moment its
 * optimistic shadow is removed.
 */
public record CommandResolution(
        CommandId commandId,
        DeviceId deviceId,
        DeviceField field,
        FieldValue value,
        CommandStatus status,
        Optional<FailureReason> failureReason
) {
    public CommandResolution {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(failureReason, "failureReason");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("resolution status must be terminal");
        }
    }
}
