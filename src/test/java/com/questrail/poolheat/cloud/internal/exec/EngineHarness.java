package com.questrail.poolheat.cloud.internal.exec;

import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.cloud.config.CommandRetryPolicy;
import com.questrail.poolheat.cloud.config.Credential;
import com.questrail.poolheat.cloud.config.SyncTimingPolicy;
import com.questrail.poolheat.cloud.internal.client.CloudClient;
import com.questrail.poolheat.cloud.internal.session.SessionManager;
import com.questrail.poolheat.cloud.internal.state.StateStore;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.RecordingSyncObservabilitySink;
import com.questrail.poolheat.cloud.time.DeterministicScheduler;
import com.questrail.poolheat.cloud.time.ManualMonotonicClock;
import com.questrail.poolheat.cloud.transport.FakeCloudTransport;

/**
 * Fully wired engine on deterministic time. Poll cycles and command sends run
 * inline on the calling thread; timers run only when the test advances time.
 *
 * Timing: poll 30s, discovery 10min, command timeout 90s, confirmation poll
 * after 5s. Retries: 3 attempts, 1s then 2s backoff.
 */
final class EngineHarness {

    static final DeviceId HP = DeviceId.of("hp-1");

    final ManualMonotonicClock clock = new ManualMonotonicClock();
    final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    final RecordingSyncObservabilitySink sink = new RecordingSyncObservabilitySink();
    final FakeCloudTransport transport = new FakeCloudTransport();
    final SyncTimingPolicy timing = SyncTimingPolicy.defaults();
    final SessionManager sessions;
    final StateStore store;
    final Poller poller;
    final CommandDispatcher dispatcher;

    EngineHarness() {
        this(3);
    }

    EngineHarness(int unavailableAfterFailedCycles) {
        sessions = new SessionManager(transport, new Credential("pool@example.com", "pw"), timing, clock, WallClock.SYSTEM, sink);
        CloudClient client = new CloudClient(transport, sessions);
        store = new StateStore(clock, WallClock.SYSTEM, sink);
        poller = new Poller(store, client, Runnable::run, scheduler, timing, unavailableAfterFailedCycles, WallClock.SYSTEM, sink);
        dispatcher = new CommandDispatcher(
                store,
                client,
                poller::device,
                poller::requestRefresh,
                Runnable::run,
                scheduler,
                timing,
                CommandRetryPolicy.defaults(),
                WallClock.SYSTEM,
                sink);
    }

    EngineHarness withHeatPump() {
        transport.addDevice(FakeCloudTransport.heatPump(HP.value()), FakeCloudTransport.idleValues());
        return this;
    }

    DeviceState state() {
        return store.get(HP).orElseThrow();
    }

    void advanceSeconds(long seconds) {
        scheduler.advanceAndRun(java.time.Duration.ofSeconds(seconds));
    }
}
