package com.questrail.poolheat.cloud.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SyncObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSyncObservabilitySink implements SyncObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSyncObservabilitySink.class);

    @Override
    public void onStateChange(DeviceStateTransitionEvent event) {
        var state = event.newState();
        if (event.isAvailabilityChange()) {
            log.info("Device {}: available {} -> {}",
                state.deviceId(),
                !state.available(),
                state.available());
        }
        log.debug("Device {} rev {} ({}): changed {}",
            state.deviceId(),
            state.revision(),
            state.source(),
            event.changedFields());
    }

    @Override
    public void onCommandEvent(CommandLifecycleEvent event) {
        switch (event.kind()) {
            case FAILED, EXPIRED -> log.warn("Command {} {} {}={} on {} after {} attempt(s): {}",
                event.commandId(), event.kind(), event.field(), event.value(),
                event.deviceId(), event.attempt(), event.detail());
            case CONFIRMED -> log.info("Command {} confirmed: {}={} on {}",
                event.commandId(), event.field(), event.value(), event.deviceId());
            default -> log.debug("Command {} {} (attempt {}): {}",
                event.commandId(), event.kind(), event.attempt(), event.detail());
        }
    }

    @Override
    public void onPollEvent(PollCycleEvent event) {
        switch (event.kind()) {
            case CYCLE_ABANDONED -> log.warn("Poll cycle abandoned ({} in a row): {}",
                event.consecutiveFailures(), event.detail());
            case DEVICES_UNAVAILABLE, DEVICE_FAILED -> log.warn("Poll {}: {}", event.kind(), event.detail());
            case DISCOVERY_COMPLETED -> log.info("Discovery completed: {} device(s)", event.deviceCount());
            default -> log.debug("Poll {}: {} device(s) {}", event.kind(), event.deviceCount(), event.detail());
        }
    }

    @Override
    public void onAuthEvent(SessionEvent event) {
        if (event.kind() == SessionEvent.Kind.AUTH_FAILED) {
            log.error("Cloud authentication failed: {}", event.detail());
        } else {
            log.info("Cloud session {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(SyncErrorEvent event) {
        log.error("Sync Error: {}", event.message(), event.cause());
    }
}
