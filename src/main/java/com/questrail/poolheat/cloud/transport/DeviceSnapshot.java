package com.questrail.poolheat.cloud.transport;

import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Device values as reported by one status fetch.
 */
public record DeviceSnapshot(DeviceId deviceId, Map<DeviceField, FieldValue> values, Set<String> faults)
{
    public DeviceSnapshot {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(faults, "faults");
        values = values.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(values));
        faults = Collections.unmodifiableSet(new LinkedHashSet<>(faults));
    }
}
