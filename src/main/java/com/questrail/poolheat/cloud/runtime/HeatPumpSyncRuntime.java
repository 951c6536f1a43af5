package com.questrail.poolheat.cloud.runtime;

import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.ControllerStatus;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.HeatPumpController;
import com.questrail.poolheat.api.StateListener;
import com.questrail.poolheat.api.Subscription;
import com.questrail.poolheat.cloud.config.HeatPumpSyncConfig;
import com.questrail.poolheat.cloud.internal.client.CloudClient;
import com.questrail.poolheat.cloud.internal.exec.CommandDispatcher;
import com.questrail.poolheat.cloud.internal.exec.Poller;
import com.questrail.poolheat.cloud.internal.session.SessionManager;
import com.questrail.poolheat.cloud.internal.state.StateStore;
import com.questrail.poolheat.cloud.internal.time.MonotonicClock;
import com.questrail.poolheat.cloud.internal.time.MonotonicScheduler;
import com.questrail.poolheat.cloud.internal.time.ScheduledExecutorScheduler;
import com.questrail.poolheat.cloud.internal.time.SystemMonotonicClock;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.NullSyncObservabilitySink;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;
import com.questrail.poolheat.cloud.transport.CloudTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HeatPumpSyncRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the synchronization engine.
 *
 * <p>Wires session manager, cloud client, state store, poller and command
 * dispatcher around a {@link CloudTransport}, and exposes the result as a
 * {@link HeatPumpController}.</p>
 *
 * <h2>Threads</h2>
 * Unless the builder is given its own, the runtime creates and owns one
 * scheduler thread (timers only), one poll thread and a small command pool.
 * Owned executors are shut down by {@link #shutdown()}.
 */
public final class HeatPumpSyncRuntime implements HeatPumpController
{
    private final SessionManager sessions;
    private final StateStore store;
    private final Poller poller;
    private final CommandDispatcher dispatcher;
    private final List<ExecutorService> ownedExecutors;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private HeatPumpSyncRuntime(SessionManager sessions,
                                StateStore store,
                                Poller poller,
                                CommandDispatcher dispatcher,
                                List<ExecutorService> ownedExecutors) {
        this.sessions = sessions;
        this.store = store;
        this.poller = poller;
        this.dispatcher = dispatcher;
        this.ownedExecutors = List.copyOf(ownedExecutors);
    }

    /**
     * Starts polling. The first cycle (login, discovery, fetch) runs at once.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime has been shut down");
        }
        if (started.compareAndSet(false, true)) {
            poller.start();
        }
    }

    @Override
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        poller.stop();
        dispatcher.shutdown();

        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
        }
        for (ExecutorService executor : ownedExecutors) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public Optional<DeviceState> getState(DeviceId deviceId) {
        return store.get(deviceId);
    }

    @Override
    public List<Device> devices() {
        return poller.devices();
    }

    @Override
    public CommandHandle issueCommand(DeviceId deviceId, DeviceField field, FieldValue value) {
        return dispatcher.issue(deviceId, field, value);
    }

    @Override
    public Subscription subscribe(DeviceId deviceId, StateListener listener) {
        return store.subscribe(deviceId, listener);
    }

    @Override
    public Subscription subscribeAll(StateListener listener) {
        return store.subscribeAll(listener);
    }

    @Override
    public void refreshNow() {
        poller.refreshNow();
    }

    /**
     * Map engine health to the public ControllerStatus.
     */
    @Override
    public ControllerStatus getStatus() {
        if (sessions.isAuthFailed()) {
            return ControllerStatus.AUTH_FAILED;
        }
        if (!poller.hasSucceeded()) {
            return ControllerStatus.DISCONNECTED;
        }

        List<DeviceState> states = store.states();
        long unavailable = states.stream().filter(s -> !s.available()).count();

        if (!states.isEmpty() && unavailable == states.size()) {
            return ControllerStatus.DISCONNECTED;
        }
        if (unavailable > 0 || poller.isLastCycleAbandoned()) {
            return ControllerStatus.DEGRADED;
        }
        return ControllerStatus.CONNECTED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HeatPumpSyncConfig config;
        private CloudTransport transport;
        private SyncObservabilitySink observabilitySink = NullSyncObservabilitySink.INSTANCE;
        private WallClock wallClock = WallClock.SYSTEM;
        private MonotonicScheduler scheduler;
        private Executor pollExecutor;
        private Executor commandExecutor;
        private int commandThreads = 2;

        public Builder withConfig(HeatPumpSyncConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(CloudTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(SyncObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Timer source. When absent, a single-threaded scheduler on the system
         * monotonic clock is created and owned by the runtime.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withPollExecutor(Executor executor) {
            this.pollExecutor = executor;
            return this;
        }

        public Builder withCommandExecutor(Executor executor) {
            this.commandExecutor = executor;
            return this;
        }

        public Builder withCommandThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1");
            }
            this.commandThreads = threads;
            return this;
        }

        public HeatPumpSyncRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");

            List<ExecutorService> owned = new ArrayList<>();

            // 1. Timing
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ScheduledThreadPoolExecutor timerExec = new ScheduledThreadPoolExecutor(1, threadFactory("poolheat-timer"));
                timerExec.setRemoveOnCancelPolicy(true);
                timerExec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
                owned.add(timerExec);
                effectiveScheduler = new ScheduledExecutorScheduler(timerExec, SystemMonotonicClock.INSTANCE);
            }
            MonotonicClock clock = effectiveScheduler.clock();

            Executor effectivePollExecutor = pollExecutor;
            if (effectivePollExecutor == null) {
                ExecutorService pollExec = Executors.newSingleThreadExecutor(threadFactory("poolheat-poll"));
                owned.add(pollExec);
                effectivePollExecutor = pollExec;
            }

            Executor effectiveCommandExecutor = commandExecutor;
            if (effectiveCommandExecutor == null) {
                ExecutorService commandExec = Executors.newFixedThreadPool(commandThreads, threadFactory("poolheat-command"));
                owned.add(commandExec);
                effectiveCommandExecutor = commandExec;
            }

            // 2. Session and client
            SessionManager sessions = new SessionManager(
                    transport,
                    config.credential(),
                    config.timingPolicy(),
                    clock,
                    wallClock,
                    observabilitySink);
            CloudClient client = new CloudClient(transport, sessions);

            // 3. State
            StateStore store = new StateStore(clock, wallClock, observabilitySink);

            // 4. Poller
            Poller poller = new Poller(
                    store,
                    client,
                    effectivePollExecutor,
                    effectiveScheduler,
                    config.timingPolicy(),
                    config.unavailableAfterFailedCycles(),
                    wallClock,
                    observabilitySink);

            // 5. Dispatcher; discovery and expedited refresh come from the poller
            CommandDispatcher dispatcher = new CommandDispatcher(
                    store,
                    client,
                    poller::device,
                    poller::requestRefresh,
                    effectiveCommandExecutor,
                    effectiveScheduler,
                    config.timingPolicy(),
                    config.retryPolicy(),
                    wallClock,
                    observabilitySink);

            return new HeatPumpSyncRuntime(sessions, store, poller, dispatcher, owned);
        }

        private static ThreadFactory threadFactory(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
