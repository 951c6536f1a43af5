package com.questrail.poolheat.api;

/**
 * Provenance of a {@link DeviceState}.
 */
public enum StateSource
{
    /**
     * Every visible value came from an authoritative poll (or a corroborated
     * command).
     */
    CONFIRMED,

    /**
     * At least one visible value is projected from a command that the cloud
     * has not yet demonstrably applied.
     */
    OPTIMISTIC
}
