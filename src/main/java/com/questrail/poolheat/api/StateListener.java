package com.questrail.poolheat.api;

/**
 * StateListener
 * -----------------------------------------------------------------------------
 * Receives notifications from a {@link HeatPumpController}.
 *
 * <h2>Delivery guarantees</h2>
 * <ul>
 *   <li>Callbacks are never invoked while the controller holds its state lock,
 *       so a listener may call back into the controller.</li>
 *   <li>Notifications are delivered one at a time, in the order the underlying
 *       changes were made.</li>
 *   <li>For one device, {@link DeviceState#revision()} strictly increases across
 *       {@link #onStateChanged(DeviceState)} calls.</li>
 * </ul>
 *
 * A listener that throws does not affect other listeners or the controller.
 */
@FunctionalInterface
public interface StateListener
{
    void onStateChanged(DeviceState state);

    /**
     * Availability flipped for a device. The accompanying state change carries
     * the same information; this hook exists for hosts that only track it.
     */
    default void onAvailabilityChanged(DeviceId deviceId, boolean available) {
    }

    default void onCommandResolved(CommandOutcome outcome) {
    }
}
