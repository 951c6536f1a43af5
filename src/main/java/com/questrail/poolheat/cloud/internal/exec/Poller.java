package com.questrail.poolheat.cloud.internal.exec;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.SyncTimingPolicy;
import com.questrail.poolheat.cloud.internal.client.CloudClient;
import com.questrail.poolheat.cloud.internal.state.StateStore;
import com.questrail.poolheat.cloud.internal.time.Cancellable;
import com.questrail.poolheat.cloud.internal.time.MonotonicScheduler;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.PollCycleEvent;
import com.questrail.poolheat.cloud.observability.SyncErrorEvent;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;
import com.questrail.poolheat.cloud.transport.DeviceSnapshot;
import com.questrail.poolheat.cloud.transport.StateFetchResult;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Poller
 * -----------------------------------------------------------------------------
 * Periodically pulls authoritative device data from the cloud into the
 * {@link StateStore}.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>List devices on the first cycle and every {@code discoveryInterval}
 *       thereafter. New devices are added; none are ever removed.</li>
 *   <li>Fetch the state of every known device in one batch.</li>
 *   <li>Apply each snapshot, stamped with the time the fetch started.</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>Retryable: the cycle is abandoned and the next tick tries again.
 *       After {@code unavailableAfterFailedCycles} abandoned cycles in a row
 *       every device is flagged unavailable.</li>
 *   <li>Fatal for one device: only that device is flagged unavailable.
 *       Repeated retryable failures for one device flag it the same way.</li>
 *   <li>Fatal for the whole call: every device is flagged unavailable.</li>
 * </ul>
 *
 * <h2>Scheduling</h2>
 * Cycles run on the poll executor, never on the scheduler thread, and never
 * overlap. The next regular cycle is scheduled when one finishes. A refresh
 * requested while a cycle runs is coalesced into a single follow-up cycle.
 */
public final class Poller
{
    private final StateStore store;
    private final CloudClient client;
    private final Executor pollExecutor;
    private final MonotonicScheduler scheduler;
    private final SyncTimingPolicy timing;
    private final int unavailableAfterFailedCycles;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    private final Object lock = new Object();

    // guarded by lock
    private final Map<DeviceId, Device> devices = new LinkedHashMap<>();
    private boolean started;
    private boolean stopped;
    private boolean cycleRunning;
    private boolean refreshRequested;
    private Cancellable nextCycle = Cancellable.NONE;
    private Cancellable expedited = Cancellable.NONE;
    private long expeditedAtNanos;
    private boolean expeditedPending;

    // touched only by the cycle, which never overlaps itself
    private final Map<DeviceId, Integer> deviceFailures = new HashMap<>();
    private boolean discovered;
    private long lastDiscoveryNanos;

    private volatile int consecutiveFailedCycles;
    private volatile boolean everSucceeded;
    private volatile boolean lastCycleAbandoned;

    public Poller(StateStore store,
                  CloudClient client,
                  Executor pollExecutor,
                  MonotonicScheduler scheduler,
                  SyncTimingPolicy timing,
                  int unavailableAfterFailedCycles,
                  WallClock wallClock,
                  SyncObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.client = Objects.requireNonNull(client, "client");
        this.pollExecutor = Objects.requireNonNull(pollExecutor, "pollExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (unavailableAfterFailedCycles < 1) {
            throw new IllegalArgumentException("unavailableAfterFailedCycles must be >= 1");
        }
        this.unavailableAfterFailedCycles = unavailableAfterFailedCycles;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Runs the first cycle immediately and keeps polling until {@link #stop()}.
     */
    public void start() {
        synchronized (lock) {
            if (started || stopped) {
                return;
            }
            started = true;
        }
        trigger();
    }

    public void stop() {
        synchronized (lock) {
            stopped = true;
            nextCycle.cancel();
            expedited.cancel();
            expeditedPending = false;
        }
    }

    /**
     * Runs a cycle as soon as possible, coalescing with one already running.
     */
    public void refreshNow() {
        trigger();
    }

    /**
     * Runs a cycle after {@code delay} unless one is already due sooner.
     */
    public void requestRefresh(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        synchronized (lock) {
            if (stopped || !started) {
                return;
            }
            long at = scheduler.clock().nowNanos() + delay.toNanos();
            if (expeditedPending && expeditedAtNanos - at <= 0) {
                return;
            }
            expedited.cancel();
            expeditedAtNanos = at;
            expeditedPending = true;
            expedited = scheduler.scheduleAtNanos(at, this::onExpedited);
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public List<Device> devices() {
        synchronized (lock) {
            return List.copyOf(devices.values());
        }
    }

    public Optional<Device> device(DeviceId deviceId) {
        synchronized (lock) {
            return Optional.ofNullable(devices.get(deviceId));
        }
    }

    /**
     * True once at least one cycle has completed without being abandoned.
     */
    public boolean hasSucceeded() {
        return everSucceeded;
    }

    public boolean isLastCycleAbandoned() {
        return lastCycleAbandoned;
    }

    public int consecutiveFailedCycles() {
        return consecutiveFailedCycles;
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    private void onExpedited() {
        synchronized (lock) {
            expeditedPending = false;
        }
        trigger();
    }

    private void trigger() {
        synchronized (lock) {
            if (stopped || !started) {
                return;
            }
            if (cycleRunning) {
                refreshRequested = true;
                return;
            }
            cycleRunning = true;
            nextCycle.cancel();
        }
        try {
            pollExecutor.execute(this::runCycle);
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                cycleRunning = false;
            }
            sink.onError(new SyncErrorEvent(wallClock.now(), "Poll executor rejected cycle", e));
        }
    }

    private void runCycle() {
        try {
            cycle();
        } catch (RuntimeException e) {
            sink.onError(new SyncErrorEvent(wallClock.now(), "Poll cycle failed unexpectedly", e));
        }

        boolean again;
        synchronized (lock) {
            cycleRunning = false;
            if (stopped) {
                return;
            }
            again = refreshRequested;
            refreshRequested = false;
            if (!again) {
                nextCycle = scheduler.scheduleAfter(timing.pollInterval(), this::trigger);
            }
        }
        if (again) {
            trigger();
        }
    }

    // ---------------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------------

    private void cycle() {
        long startedAt = scheduler.clock().nowNanos();
        int deviceCount = 0;
        try {
            if (!discovered || startedAt - lastDiscoveryNanos >= timing.discoveryInterval().toNanos()) {
                discover(startedAt);
            }

            List<DeviceId> ids = store.deviceIds();
            deviceCount = ids.size();
            if (!ids.isEmpty()) {
                long observedAt = scheduler.clock().nowNanos();
                StateFetchResult result = client.getStates(ids);
                applyResult(result, observedAt);
            }
        } catch (AuthenticationException e) {
            abandon(deviceCount, "authentication failed: " + e.reason());
            return;
        } catch (TransportException e) {
            if (e.isRetryable()) {
                abandon(deviceCount, e.getMessage());
            } else {
                store.markAllUnavailable();
                lastCycleAbandoned = true;
                emit(PollCycleEvent.Kind.DEVICES_UNAVAILABLE, deviceCount, "fatal poll failure: " + e.getMessage());
            }
            return;
        }

        consecutiveFailedCycles = 0;
        lastCycleAbandoned = false;
        everSucceeded = true;
        emit(PollCycleEvent.Kind.CYCLE_COMPLETED, deviceCount, "");
    }

    private void discover(long now) {
        List<Device> listed = client.listDevices();
        for (Device device : listed) {
            synchronized (lock) {
                devices.put(device.id(), device);
            }
            store.registerDevice(device.id());
        }
        discovered = true;
        lastDiscoveryNanos = now;
        emit(PollCycleEvent.Kind.DISCOVERY_COMPLETED, listed.size(), "");
    }

    private void applyResult(StateFetchResult result, long observedAt) {
        for (DeviceSnapshot snapshot : result.snapshots()) {
            deviceFailures.remove(snapshot.deviceId());
            store.applyConfirmed(snapshot, observedAt);
        }
        for (Map.Entry<DeviceId, TransportException> failure : result.failures().entrySet()) {
            DeviceId id = failure.getKey();
            TransportException e = failure.getValue();
            int count = deviceFailures.merge(id, 1, Integer::sum);
            emit(PollCycleEvent.Kind.DEVICE_FAILED, 1, id + ": " + e.getMessage());
            if (!e.isRetryable() || count >= unavailableAfterFailedCycles) {
                store.markUnavailable(id);
            }
        }
    }

    private void abandon(int deviceCount, String reason) {
        int failures = consecutiveFailedCycles + 1;
        consecutiveFailedCycles = failures;
        lastCycleAbandoned = true;
        sink.onPollEvent(new PollCycleEvent(wallClock.now(), PollCycleEvent.Kind.CYCLE_ABANDONED,
                deviceCount, failures, reason));
        if (failures >= unavailableAfterFailedCycles) {
            store.markAllUnavailable();
            emit(PollCycleEvent.Kind.DEVICES_UNAVAILABLE, deviceCount,
                    failures + " consecutive cycles abandoned");
        }
    }

    private void emit(PollCycleEvent.Kind kind, int deviceCount, String detail) {
        sink.onPollEvent(new PollCycleEvent(wallClock.now(), kind, deviceCount, consecutiveFailedCycles, detail));
    }
}
