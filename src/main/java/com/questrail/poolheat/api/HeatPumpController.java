package com.questrail.poolheat.api;

import java.util.List;
import java.util.Optional;

/**
 * HeatPumpController
 * -----------------------------------------------------------------------------
 * {@code HeatPumpController} is the semantic façade a host application (a
 * home-automation platform, a CLI, a test harness) uses to observe and command
 * pool heat pumps reached through a vendor cloud.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Keeping a low-latency local view of every device on the account</li>
 *   <li>Reflecting commands immediately as optimistic state</li>
 *   <li>Declaring a command successful only once polling shows the device
 *       reached the requested value</li>
 *   <li>Reporting link health through {@link #getStatus()}</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for entity models, UI registration,
 * credential-entry flows or configuration loading; those belong to the host.
 *
 * <h2>Threading</h2>
 * All methods are safe to call from any thread, including from inside a
 * {@link StateListener} callback. Command submission never blocks on the
 * network.
 */
public interface HeatPumpController
{
    /**
     * Returns the current visible state of a device, if it has been discovered.
     */
    Optional<DeviceState> getState(DeviceId deviceId);

    /**
     * Returns every discovered device in discovery order.
     */
    List<Device> devices();

    /**
     * Issues a command. The requested value becomes visible immediately as
     * optimistic state.
     *
     * @throws UnknownDeviceException       if the device has not been discovered
     * @throws UnsupportedCommandException  if the device cannot accept the value
     */
    CommandHandle issueCommand(DeviceId deviceId, DeviceField field, FieldValue value);

    /**
     * Subscribes to one device.
     */
    Subscription subscribe(DeviceId deviceId, StateListener listener);

    /**
     * Subscribes to every device, including ones discovered later.
     */
    Subscription subscribeAll(StateListener listener);

    /**
     * Requests an immediate poll cycle. Coalesces with a cycle already running.
     */
    void refreshNow();

    ControllerStatus getStatus();

    /**
     * Stops polling, cancels command retries and expires pending commands.
     * Idempotent.
     */
    void shutdown();

    default CommandHandle setPower(DeviceId deviceId, boolean on) {
        return issueCommand(deviceId, DeviceField.POWER, FieldValue.of(on));
    }

    default CommandHandle setOperatingMode(DeviceId deviceId, OperatingMode mode) {
        return issueCommand(deviceId, DeviceField.OPERATING_MODE, mode.toFieldValue());
    }

    default CommandHandle setTargetTemperature(DeviceId deviceId, int celsius) {
        return issueCommand(deviceId, DeviceField.TARGET_TEMPERATURE, FieldValue.of(celsius));
    }

    default CommandHandle setRunningMode(DeviceId deviceId, int preset) {
        return issueCommand(deviceId, DeviceField.RUNNING_MODE, FieldValue.of(preset));
    }
}
