package com.questrail.poolheat.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Device
 * -----------------------------------------------------------------------------
 * A heat pump discovered on the account.
 *
 * <p>Immutable after discovery. {@code capabilities} lists every field the
 * device reports, with its writability and limits; a field absent from the
 * map is not supported by the device at all.</p>
 */
public record Device(
        DeviceId id,
        String name,
        String model,
        String firmwareVersion,
        String serialNumber,
        Map<DeviceField, FieldCapability> capabilities
) {
    public Device {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(firmwareVersion, "firmwareVersion");
        Objects.requireNonNull(serialNumber, "serialNumber");
        Objects.requireNonNull(capabilities, "capabilities");
        capabilities = capabilities.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(capabilities));
    }

    public Optional<FieldCapability> capability(DeviceField field) {
        return Optional.ofNullable(capabilities.get(field));
    }

    public boolean supports(DeviceField field) {
        return capabilities.containsKey(field);
    }
}
