package com.questrail.poolheat.api;

/**
 * The device id is not among the devices discovered on the account.
 */
public final class UnknownDeviceException extends HeatPumpException
{
    private final DeviceId deviceId;

    public UnknownDeviceException(DeviceId deviceId) {
        super("unknown device: " + deviceId);
        this.deviceId = deviceId;
    }

    public DeviceId deviceId() {
        return deviceId;
    }
}
