package com.questrail.poolheat.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DeviceState
 * -----------------------------------------------------------------------------
 * Immutable, versioned snapshot of one device as currently visible to observers.
 *
 * <h2>Revision</h2>
 * {@code revision} increases strictly with every visible change of the same
 * device. Observers can discard any snapshot whose revision is not greater than
 * one they already hold.
 *
 * <h2>Optimistic values</h2>
 * {@code pendingFields} names the fields whose visible value is projected from
 * a command still awaiting corroboration. {@code source} is
 * {@link StateSource#OPTIMISTIC} exactly when that set is non-empty.
 *
 * <h2>Availability</h2>
 * When polling cannot reach the device, {@code available} is {@code false};
 * the last known values are retained but should be treated as stale.
 * {@code updatedAt} is wall-clock time for display only.
 */
public record DeviceState(
        DeviceId deviceId,
        Map<DeviceField, FieldValue> values,
        long revision,
        StateSource source,
        Set<DeviceField> pendingFields,
        boolean available,
        Set<String> faults,
        Instant updatedAt
) {
    public DeviceState {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(pendingFields, "pendingFields");
        Objects.requireNonNull(faults, "faults");
        Objects.requireNonNull(updatedAt, "updatedAt");

        values = values.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(values));
        pendingFields = pendingFields.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(pendingFields));
        faults = Collections.unmodifiableSet(new LinkedHashSet<>(faults));

        if ((source == StateSource.OPTIMISTIC) == pendingFields.isEmpty()) {
            throw new IllegalArgumentException("source must be OPTIMISTIC exactly when fields are pending");
        }
    }

    public Optional<FieldValue> value(DeviceField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean isPending(DeviceField field) {
        return pendingFields.contains(field);
    }

    public Optional<Boolean> power() {
        return value(DeviceField.POWER)
                .filter(FieldValue.Switch.class::isInstance)
                .map(v -> ((FieldValue.Switch) v).on());
    }

    public Optional<OperatingMode> operatingMode() {
        return number(DeviceField.OPERATING_MODE)
                .flatMap(v -> OperatingMode.fromCode(v.intValue()));
    }

    public Optional<BigDecimal> targetTemperature() {
        return number(DeviceField.TARGET_TEMPERATURE);
    }

    public Optional<BigDecimal> measuredTemperature() {
        return number(DeviceField.INLET_WATER_TEMPERATURE);
    }

    /**
     * Instantaneous power draw in kW.
     */
    public Optional<BigDecimal> powerDraw() {
        return number(DeviceField.POWER_DRAW);
    }

    public Optional<BigDecimal> number(DeviceField field) {
        return value(field)
                .filter(FieldValue.Number.class::isInstance)
                .map(v -> ((FieldValue.Number) v).value());
    }
}
