package com.questrail.poolheat.api;

/**
 * A command was rejected before anything was sent because the device does not
 * support the field or the value.
 */
public final class UnsupportedCommandException extends HeatPumpException
{
    private final DeviceId deviceId;
    private final DeviceField field;

    public UnsupportedCommandException(DeviceId deviceId, DeviceField field, String reason) {
        super("unsupported command " + field + " on " + deviceId + ": " + reason);
        this.deviceId = deviceId;
        this.field = field;
    }

    public DeviceId deviceId() {
        return deviceId;
    }

    public DeviceField field() {
        return field;
    }
}
