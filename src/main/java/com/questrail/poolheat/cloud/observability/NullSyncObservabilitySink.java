package com.questrail.poolheat.cloud.observability;

/**
 * No-op implementation of SyncObservabilitySink.
 */
public final class NullSyncObservabilitySink implements SyncObservabilitySink {
    public static final NullSyncObservabilitySink INSTANCE = new NullSyncObservabilitySink();

    private NullSyncObservabilitySink() {}

    @Override
    public void onStateChange(DeviceStateTransitionEvent event) {}

    @Override
    public void onCommandEvent(CommandLifecycleEvent event) {}

    @Override
    public void onPollEvent(PollCycleEvent event) {}

    @Override
    public void onAuthEvent(SessionEvent event) {}

    @Override
    public void onError(SyncErrorEvent event) {}
}
