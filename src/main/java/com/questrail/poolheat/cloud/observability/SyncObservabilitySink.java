package com.questrail.poolheat.cloud.observability;

/**
 * Main interface for receiving synchronization engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Implementations must be thread-safe; callbacks arrive from poller,
 * dispatcher and caller threads.</p>
 */
public interface SyncObservabilitySink {
    /**
     * Called when the externally visible state of a device changes.
     * @param event the transition details
     */
    void onStateChange(DeviceStateTransitionEvent event);

    /**
     * Called as a command moves through its lifecycle (issued, sent, retried, resolved).
     * @param event the command event
     */
    void onCommandEvent(CommandLifecycleEvent event);

    /**
     * Called for poll cycle milestones and per-device poll failures.
     * @param event the poll event
     */
    void onPollEvent(PollCycleEvent event);

    /**
     * Called for session lifecycle events (login, refresh, rejection).
     * @param event the session event
     */
    void onAuthEvent(SessionEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     * @param event the error event
     */
    void onError(SyncErrorEvent event);
}
