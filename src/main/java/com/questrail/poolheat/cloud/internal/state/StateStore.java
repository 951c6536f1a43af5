package com.questrail.poolheat.cloud.internal.state;

import com.questrail.poolheat.api.CommandId;
import com.questrail.poolheat.api.CommandOutcome;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.api.FailureReason;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.StateListener;
import com.questrail.poolheat.api.StateSource;
import com.questrail.poolheat.api.Subscription;
import com.questrail.poolheat.api.UnknownDeviceException;
import com.questrail.poolheat.cloud.internal.time.MonotonicClock;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.DeviceStateTransitionEvent;
import com.questrail.poolheat.cloud.observability.SyncErrorEvent;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;
import com.questrail.poolheat.cloud.transport.DeviceSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * StateStore
 * -----------------------------------------------------------------------------
 * Sole owner of mutable device state.
 *
 * <h2>Model</h2>
 * Each device keeps a <em>confirmed baseline</em> (the latest polled values)
 * and, per field, at most one <em>optimistic shadow</em> belonging to a
 * pending command. The visible value of a field is its shadow when one exists,
 * otherwise its baseline value. Polled data always updates the baseline, even
 * for shadowed fields, so nothing confirmed is discarded.
 *
 * <h2>Serialization</h2>
 * Every mutation runs under one lock. The revision of a device increases by one
 * with every mutation that changes what observers can see; mutations that
 * change nothing visible leave it untouched and notify no one.
 *
 * <h2>Resolution</h2>
 * A command's shadow is removed in exactly one place: corroboration inside
 * {@link #applyConfirmed}, supersession inside {@link #applyOptimistic}, or an
 * explicit {@link #resolve}. Whichever happens first under the lock wins, and a
 * single {@link CommandResolution} is emitted for it.
 *
 * <h2>Notification</h2>
 * Notifications are queued under the lock and delivered after it is released,
 * one at a time in queue order, by whichever thread drains first. Listeners may
 * call back into the store; their notifications join the same queue.
 */
public final class StateStore
{
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    private final Object lock = new Object();

    // guarded by lock
    private final Map<DeviceId, Entry> entries = new LinkedHashMap<>();

    private final List<StateListener> globalListeners = new CopyOnWriteArrayList<>();
    private final Map<DeviceId, List<StateListener>> deviceListeners = new ConcurrentHashMap<>();
    private final List<Consumer<CommandResolution>> resolutionHandlers = new CopyOnWriteArrayList<>();

    private final Queue<Runnable> notifications = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public StateStore(MonotonicClock clock, WallClock wallClock, SyncObservabilitySink sink) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<DeviceState> get(DeviceId deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        synchronized (lock) {
            Entry entry = entries.get(deviceId);
            return entry == null ? Optional.empty() : Optional.of(entry.published);
        }
    }

    public boolean contains(DeviceId deviceId) {
        synchronized (lock) {
            return entries.containsKey(deviceId);
        }
    }

    public List<DeviceId> deviceIds() {
        synchronized (lock) {
            return List.copyOf(entries.keySet());
        }
    }

    public List<DeviceState> states() {
        synchronized (lock) {
            List<DeviceState> states = new ArrayList<>(entries.size());
            for (Entry entry : entries.values()) {
                states.add(entry.published);
            }
            return states;
        }
    }

    // ---------------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------------

    /**
     * Adds a newly discovered device with an empty, unavailable state until its
     * first poll. Registering a known device is a no-op.
     *
     * @return true if the device was new
     */
    public boolean registerDevice(DeviceId deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        synchronized (lock) {
            if (entries.containsKey(deviceId)) {
                return false;
            }
            Entry entry = new Entry(deviceId);
            entry.published = new DeviceState(deviceId, Map.of(), 0L, StateSource.CONFIRMED,
                    Set.of(), false, Set.of(), wallClock.now());
            entries.put(deviceId, entry);
            return true;
        }
    }

    /**
     * Merges polled values into the baseline, marks the device available, and
     * corroborates any accepted command whose requested value the snapshot
     * shows.
     *
     * @param observedAtNanos monotonic time at which the fetch producing the
     *                        snapshot was started; only commands accepted no
     *                        later than this can be corroborated by it
     */
    public void applyConfirmed(DeviceSnapshot snapshot, long observedAtNanos) {
        Objects.requireNonNull(snapshot, "snapshot");
        synchronized (lock) {
            Entry entry = entries.get(snapshot.deviceId());
            if (entry == null) {
                return;
            }
            entry.baseline.putAll(snapshot.values());
            entry.faults = new LinkedHashSet<>(snapshot.faults());
            entry.available = true;

            Iterator<Map.Entry<DeviceField, Shadow>> it = entry.shadows.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<DeviceField, Shadow> e = it.next();
                Shadow shadow = e.getValue();
                if (shadow.isCorroboratedBy(entry.baseline.get(e.getKey()), observedAtNanos)) {
                    it.remove();
                    queueResolution(entry.deviceId, e.getKey(), shadow, CommandStatus.CONFIRMED, Optional.empty());
                }
            }
            publishIfChanged(entry);
        }
        drain();
    }

    /**
     * Flags a device unavailable; its last known values are retained.
     */
    public void markUnavailable(DeviceId deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        synchronized (lock) {
            Entry entry = entries.get(deviceId);
            if (entry == null || !entry.available) {
                return;
            }
            entry.available = false;
            publishIfChanged(entry);
        }
        drain();
    }

    public void markAllUnavailable() {
        synchronized (lock) {
            for (Entry entry : entries.values()) {
                if (entry.available) {
                    entry.available = false;
                    publishIfChanged(entry);
                }
            }
        }
        drain();
    }

    /**
     * Projects a command's requested value over the baseline. A command already
     * shadowing the same field is superseded.
     *
     * @return the resulting visible state
     * @throws UnknownDeviceException if the device is not registered
     */
    public DeviceState applyOptimistic(DeviceId deviceId, DeviceField field, FieldValue value, CommandId commandId) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(commandId, "commandId");
        DeviceState result;
        synchronized (lock) {
            Entry entry = entries.get(deviceId);
            if (entry == null) {
                throw new UnknownDeviceException(deviceId);
            }
            Shadow previous = entry.shadows.put(field, new Shadow(commandId, value));
            if (previous != null) {
                queueResolution(deviceId, field, previous, CommandStatus.FAILED, Optional.of(FailureReason.SUPERSEDED));
            }
            publishIfChanged(entry);
            result = entry.published;
        }
        drain();
        return result;
    }

    /**
     * Records that the cloud accepted the command. From now on a fresh poll
     * showing the requested value corroborates it.
     *
     * @return false if the command no longer owns its shadow
     */
    public boolean markAccepted(DeviceId deviceId, DeviceField field, CommandId commandId) {
        synchronized (lock) {
            Shadow shadow = ownedShadow(deviceId, field, commandId);
            if (shadow == null) {
                return false;
            }
            shadow.acceptedAtNanos = clock.nowNanos();
            shadow.accepted = true;
            return true;
        }
    }

    /**
     * Resolves a command that still owns its shadow. On {@code CONFIRMED} the
     * baseline adopts the requested value; otherwise the field reverts to the
     * baseline.
     *
     * @return false if the command was already resolved elsewhere
     */
    public boolean resolve(DeviceId deviceId, DeviceField field, CommandId commandId,
                           CommandStatus status, Optional<FailureReason> reason) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(reason, "reason");
        synchronized (lock) {
            Shadow shadow = ownedShadow(deviceId, field, commandId);
            if (shadow == null) {
                return false;
            }
            Entry entry = entries.get(deviceId);
            entry.shadows.remove(field);
            if (status == CommandStatus.CONFIRMED) {
                entry.baseline.put(field, shadow.value);
            }
            queueResolution(deviceId, field, shadow, status, reason);
            publishIfChanged(entry);
        }
        drain();
        return true;
    }

    /**
     * Queues delivery of a terminal command outcome to listeners of its device.
     */
    public void publishOutcome(CommandOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        notifications.add(() -> {
            for (StateListener listener : listenersFor(outcome.deviceId())) {
                try {
                    listener.onCommandResolved(outcome);
                } catch (RuntimeException e) {
                    reportListenerFailure("onCommandResolved", e);
                }
            }
        });
        drain();
    }

    // ---------------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------------

    public Subscription subscribe(DeviceId deviceId, StateListener listener) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(listener, "listener");
        List<StateListener> list = deviceListeners.computeIfAbsent(deviceId, id -> new CopyOnWriteArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    public Subscription subscribeAll(StateListener listener) {
        Objects.requireNonNull(listener, "listener");
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /**
     * Registers the engine-internal handler that learns of every command resolution.
     */
    public void onResolution(Consumer<CommandResolution> handler) {
        resolutionHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Shadow ownedShadow(DeviceId deviceId, DeviceField field, CommandId commandId) {
        Entry entry = entries.get(deviceId);
        if (entry == null) {
            return null;
        }
        Shadow shadow = entry.shadows.get(field);
        return shadow != null && shadow.commandId.equals(commandId) ? shadow : null;
    }

    private void queueResolution(DeviceId deviceId, DeviceField field, Shadow shadow,
                                 CommandStatus status, Optional<FailureReason> reason) {
        CommandResolution resolution = new CommandResolution(shadow.commandId, deviceId, field, shadow.value, status, reason);
        notifications.add(() -> {
            for (Consumer<CommandResolution> handler : resolutionHandlers) {
                try {
                    handler.accept(resolution);
                } catch (RuntimeException e) {
                    sink.onError(new SyncErrorEvent(wallClock.now(),
                            "Resolution handler failed for " + resolution.commandId(), e));
                }
            }
        });
    }

    private void publishIfChanged(Entry entry) {
        DeviceState previous = entry.published;
        Map<DeviceField, FieldValue> visible = new EnumMap<>(DeviceField.class);
        visible.putAll(entry.baseline);
        for (Map.Entry<DeviceField, Shadow> e : entry.shadows.entrySet()) {
            visible.put(e.getKey(), e.getValue().value);
        }
        Set<DeviceField> pending = entry.shadows.keySet();

        boolean changed = !visible.equals(previous.values())
                || !pending.equals(previous.pendingFields())
                || entry.available != previous.available()
                || !entry.faults.equals(previous.faults());
        if (!changed) {
            return;
        }

        DeviceState next = new DeviceState(
                entry.deviceId,
                visible,
                previous.revision() + 1,
                pending.isEmpty() ? StateSource.CONFIRMED : StateSource.OPTIMISTIC,
                pending,
                entry.available,
                entry.faults,
                wallClock.now());
        entry.published = next;

        boolean availabilityChanged = previous.available() != next.available();
        notifications.add(() -> deliverState(previous, next, availabilityChanged));
    }

    private void deliverState(DeviceState previous, DeviceState next, boolean availabilityChanged) {
        sink.onStateChange(new DeviceStateTransitionEvent(wallClock.now(), Optional.of(previous), next));
        for (StateListener listener : listenersFor(next.deviceId())) {
            try {
                listener.onStateChanged(next);
                if (availabilityChanged) {
                    listener.onAvailabilityChanged(next.deviceId(), next.available());
                }
            } catch (RuntimeException e) {
                reportListenerFailure("onStateChanged", e);
            }
        }
    }

    private Collection<StateListener> listenersFor(DeviceId deviceId) {
        List<StateListener> all = new ArrayList<>(globalListeners);
        List<StateListener> specific = deviceListeners.get(deviceId);
        if (specific != null) {
            all.addAll(specific);
        }
        return all;
    }

    private void reportListenerFailure(String callback, RuntimeException e) {
        sink.onError(new SyncErrorEvent(wallClock.now(), "State listener " + callback + " threw", e));
    }

    /**
     * Delivers queued notifications until the queue is empty. Only one thread
     * delivers at a time; a thread arriving while another drains leaves its
     * items to that thread.
     */
    private void drain() {
        while (!notifications.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                Runnable next;
                while ((next = notifications.poll()) != null) {
                    next.run();
                }
            } finally {
                draining.set(false);
            }
        }
    }

    private static final class Entry
    {
        final DeviceId deviceId;
        final Map<DeviceField, FieldValue> baseline = new EnumMap<>(DeviceField.class);
        final Map<DeviceField, Shadow> shadows = new EnumMap<>(DeviceField.class);
        Set<String> faults = new LinkedHashSet<>();
        boolean available;
        DeviceState published;

        Entry(DeviceId deviceId) {
            this.deviceId = deviceId;
        }
    }

    private static final class Shadow
    {
        final CommandId commandId;
        final FieldValue value;
        boolean accepted;
        long acceptedAtNanos;

        Shadow(CommandId commandId, FieldValue value) {
            this.commandId = commandId;
            this.value = value;
        }

        boolean isCorroboratedBy(FieldValue polled, long observedAtNanos) {
            return accepted
                    && observedAtNanos - acceptedAtNanos >= 0
                    && value.equals(polled);
        }
    }
}
