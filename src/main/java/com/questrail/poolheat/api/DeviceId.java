package com.questrail.poolheat.api;

import java.util.Objects;

/**
 * DeviceId
 * -----------------------------------------------------------------------------
 * Stable identifier of a heat pump as assigned by the vendor cloud.
 *
 * <p>The value is opaque. It is never parsed, only compared and echoed back to
 * the cloud on subsequent requests.</p>
 */
public record DeviceId(String value)
{
    public DeviceId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("device id must not be blank");
        }
    }

    public static DeviceId of(String value) {
        return new DeviceId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
