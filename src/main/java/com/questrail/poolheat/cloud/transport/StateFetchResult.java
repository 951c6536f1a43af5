package com.questrail.poolheat.cloud.transport;

import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.TransportException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a batch status fetch. Devices whose individual fetch failed are
 * listed in {@code failures} and absent from {@code snapshots}.
 */
public record StateFetchResult(List<DeviceSnapshot> snapshots, Map<DeviceId, TransportException> failures)
{
    public StateFetchResult {
        Objects.requireNonNull(snapshots, "snapshots");
        Objects.requireNonNull(failures, "failures");
        snapshots = List.copyOf(snapshots);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static StateFetchResult of(List<DeviceSnapshot> snapshots) {
        return new StateFetchResult(snapshots, Map.of());
    }
}
