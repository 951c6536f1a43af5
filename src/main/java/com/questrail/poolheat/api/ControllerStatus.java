package com.questrail.poolheat.api;

/**
 * ControllerStatus
 * -----------------------------------------------------------------------------
 * {@code ControllerStatus} represents the coarse health of a
 * {@link HeatPumpController}'s link to the vendor cloud.
 *
 * <h2>Semantic, Not Electrical</h2>
 * The status describes whether the controller is able to keep its local view
 * in step with the cloud. It says nothing about whether the heat pumps
 * themselves are working; device faults are reported per device in
 * {@link DeviceState#faults()}.
 *
 * <h2>Status Transitions</h2>
 * No ordering is guaranteed between transitions. A controller may move freely
 * between states as polls succeed or fail.
 */
public enum ControllerStatus
{
    /**
     * No successful poll has completed yet, or every known device is currently
     * unavailable.
     */
    DISCONNECTED,

    /**
     * The last poll cycle succeeded and every known device is available.
     */
    CONNECTED,

    /**
     * The controller is communicating with the cloud, but the last cycle was
     * abandoned or at least one device is unavailable.
     */
    DEGRADED,

    /**
     * The cloud refused the configured credential. User action is required;
     * the controller keeps retrying login on each poll tick.
     */
    AUTH_FAILED
}
