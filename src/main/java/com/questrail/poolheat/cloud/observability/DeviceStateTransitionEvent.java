package com.questrail.poolheat.cloud.observability;

import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceState;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Record representing a change of a device's externally visible state.
 */
public record DeviceStateTransitionEvent(
    Instant timestamp,
    Optional<DeviceState> oldState,
    DeviceState newState
) {
    public DeviceStateTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
    }

    /**
     * Checks if the availability flag flipped during this transition.
     */
    public boolean isAvailabilityChange() {
        return oldState.map(s -> s.available() != newState.available()).orElse(false);
    }

    /**
     * Returns the fields whose visible value differs between the two states.
     */
    public Set<DeviceField> changedFields() {
        Set<DeviceField> changed = EnumSet.noneOf(DeviceField.class);
        for (DeviceField field : DeviceField.values()) {
            Object before = oldState.flatMap(s -> s.value(field)).orElse(null);
            Object after = newState.value(field).orElse(null);
            if (!Objects.equals(before, after)) {
                changed.add(field);
            }
        }
        return changed;
    }
}
