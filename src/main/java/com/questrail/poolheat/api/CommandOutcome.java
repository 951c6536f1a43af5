package com.questrail.poolheat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of a command, delivered once to the issuer and to every
 * subscribed {@link StateListener}.
 */
public record CommandOutcome(
        CommandId commandId,
        DeviceId deviceId,
        DeviceField field,
        FieldValue value,
        CommandStatus status,
        Optional<FailureReason> failureReason,
        int attempts
) {
    public CommandOutcome {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(failureReason, "failureReason");

        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal");
        }
        if ((status == CommandStatus.CONFIRMED) != failureReason.isEmpty()) {
            throw new IllegalArgumentException("failureReason must be present exactly when not CONFIRMED");
        }
    }

    public boolean isConfirmed() {
        return status == CommandStatus.CONFIRMED;
    }
}
