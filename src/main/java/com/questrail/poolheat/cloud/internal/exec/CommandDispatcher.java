package com.questrail.poolheat.cloud.internal.exec;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.CommandId;
import com.questrail.poolheat.api.CommandOutcome;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FailureReason;
import com.questrail.poolheat.api.FieldCapability;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.api.UnknownDeviceException;
import com.questrail.poolheat.api.UnsupportedCommandException;
import com.questrail.poolheat.cloud.config.CommandRetryPolicy;
import com.questrail.poolheat.cloud.config.SyncTimingPolicy;
import com.questrail.poolheat.cloud.internal.client.CloudClient;
import com.questrail.poolheat.cloud.internal.state.CommandResolution;
import com.questrail.poolheat.cloud.internal.state.StateStore;
import com.questrail.poolheat.cloud.internal.time.MonotonicScheduler;
import com.questrail.poolheat.cloud.internal.time.WallClock;
import com.questrail.poolheat.cloud.observability.CommandLifecycleEvent;
import com.questrail.poolheat.cloud.observability.SyncErrorEvent;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * CommandDispatcher
 * -----------------------------------------------------------------------------
 * Drives each command through {@code PENDING -> CONFIRMED | FAILED | EXPIRED}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Validate against the device's capabilities; reject synchronously.</li>
 *   <li>Project the value into the {@link StateStore} as optimistic state.</li>
 *   <li>Send on the command executor. Retryable failures are retried with
 *       exponential backoff through the scheduler; exhaustion or a fatal error
 *       fails the command.</li>
 *   <li>Cloud acceptance only marks the shadow accepted and requests an
 *       expedited poll. Success is declared when polling corroborates it.</li>
 *   <li>A command still pending {@code commandTimeout} after it was issued
 *       expires, whether or not the cloud accepted it.</li>
 * </ol>
 *
 * <h2>Completion</h2>
 * Handles complete only from the store's {@link CommandResolution}, so every
 * command resolves exactly once no matter which of corroboration, timeout,
 * failure or supersession happens first. No thread ever sleeps here.
 */
public final class CommandDispatcher
{
    private final StateStore store;
    private final CloudClient client;
    private final Function<DeviceId, Optional<Device>> deviceDirectory;
    private final Consumer<Duration> refreshRequester;
    private final Executor commandExecutor;
    private final MonotonicScheduler scheduler;
    private final SyncTimingPolicy timing;
    private final CommandRetryPolicy retryPolicy;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<CommandId, PendingCommand> pending = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public CommandDispatcher(StateStore store,
                             CloudClient client,
                             Function<DeviceId, Optional<Device>> deviceDirectory,
                             Consumer<Duration> refreshRequester,
                             Executor commandExecutor,
                             MonotonicScheduler scheduler,
                             SyncTimingPolicy timing,
                             CommandRetryPolicy retryPolicy,
                             WallClock wallClock,
                             SyncObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.client = Objects.requireNonNull(client, "client");
        this.deviceDirectory = Objects.requireNonNull(deviceDirectory, "deviceDirectory");
        this.refreshRequester = Objects.requireNonNull(refreshRequester, "refreshRequester");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "commandExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        store.onResolution(this::onResolution);
    }

    /**
     * Issues a command. Never blocks on the network.
     *
     * @throws UnknownDeviceException      if the device has not been discovered
     * @throws UnsupportedCommandException if the device cannot take the value
     * @throws IllegalStateException       after {@link #shutdown()}
     */
    public CommandHandle issue(DeviceId deviceId, DeviceField field, FieldValue value) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        if (shutdown) {
            throw new IllegalStateException("command dispatcher is shut down");
        }

        Device device = deviceDirectory.apply(deviceId).orElseThrow(() -> new UnknownDeviceException(deviceId));
        validate(device, field, value);

        CommandId id = new CommandId(sequence.incrementAndGet());
        PendingCommand command = new PendingCommand(id, deviceId, field, value, scheduler.clock().nowNanos());
        pending.put(id, command);
        emit(command, CommandLifecycleEvent.Kind.ISSUED, "issued");

        try {
            store.applyOptimistic(deviceId, field, value, id);
        } catch (UnknownDeviceException e) {
            pending.remove(id);
            throw e;
        }

        command.setTimeoutTimer(scheduler.scheduleAtNanos(
                command.createdAtNanos() + timing.commandTimeout().toNanos(),
                () -> expire(command, FailureReason.TIMEOUT)));
        submitAttempt(command);
        return command;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Rejects further commands and expires every pending one with
     * {@link FailureReason#SHUTDOWN}. Idempotent.
     */
    public void shutdown() {
        shutdown = true;
        for (PendingCommand command : List.copyOf(pending.values())) {
            expire(command, FailureReason.SHUTDOWN);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static void validate(Device device, DeviceField field, FieldValue value) {
        if (!field.isWritable()) {
            throw new UnsupportedCommandException(device.id(), field, "field is read-only");
        }
        if (!field.accepts(value)) {
            throw new UnsupportedCommandException(device.id(), field,
                    "expects a " + field.kind().name().toLowerCase() + " value, got " + value);
        }
        FieldCapability capability = device.capability(field).orElseThrow(
                () -> new UnsupportedCommandException(device.id(), field, "device does not report this field"));
        Optional<String> violation = capability.violation(value);
        if (violation.isPresent()) {
            throw new UnsupportedCommandException(device.id(), field, violation.get());
        }
    }

    private void submitAttempt(PendingCommand command) {
        try {
            commandExecutor.execute(() -> attempt(command));
        } catch (RejectedExecutionException e) {
            fail(command, FailureReason.SHUTDOWN);
        }
    }

    private void attempt(PendingCommand command) {
        if (command.isDone()) {
            return;
        }
        int attempt = command.recordAttempt();
        emit(command, CommandLifecycleEvent.Kind.SEND_ATTEMPT, "attempt " + attempt);

        try {
            client.sendCommand(command.deviceId(), command.field(), command.value());
        } catch (TransportException e) {
            if (e.isRetryable() && attempt < retryPolicy.maxAttempts()) {
                scheduleRetry(command, attempt, e);
            } else {
                fail(command, e.isRetryable() ? FailureReason.TRANSPORT_EXHAUSTED : FailureReason.FATAL_TRANSPORT);
            }
            return;
        } catch (AuthenticationException e) {
            fail(command, FailureReason.AUTHENTICATION);
            return;
        } catch (RuntimeException e) {
            sink.onError(new SyncErrorEvent(wallClock.now(), "Unexpected failure sending " + command.id(), e));
            fail(command, FailureReason.FATAL_TRANSPORT);
            return;
        }

        if (store.markAccepted(command.deviceId(), command.field(), command.id())) {
            emit(command, CommandLifecycleEvent.Kind.ACCEPTED, "awaiting corroboration");
            refreshRequester.accept(timing.confirmationPollDelay());
        }
    }

    private void scheduleRetry(PendingCommand command, int attempt, TransportException cause) {
        Duration backoff = retryPolicy.backoffAfter(attempt);
        emit(command, CommandLifecycleEvent.Kind.RETRY_SCHEDULED,
                "retry in " + backoff.toMillis() + "ms after: " + cause.getMessage());
        command.setRetryTimer(scheduler.scheduleAfter(backoff, () -> submitAttempt(command)));
    }

    private void fail(PendingCommand command, FailureReason reason) {
        store.resolve(command.deviceId(), command.field(), command.id(), CommandStatus.FAILED, Optional.of(reason));
    }

    private void expire(PendingCommand command, FailureReason reason) {
        store.resolve(command.deviceId(), command.field(), command.id(), CommandStatus.EXPIRED, Optional.of(reason));
    }

    private void onResolution(CommandResolution resolution) {
        PendingCommand command = pending.remove(resolution.commandId());
        if (command == null) {
            return;
        }
        CommandOutcome outcome = new CommandOutcome(
                command.id(),
                command.deviceId(),
                command.field(),
                command.value(),
                resolution.status(),
                resolution.failureReason(),
                command.attempts());
        if (!command.complete(outcome)) {
            return;
        }

        CommandLifecycleEvent.Kind kind = switch (resolution.status()) {
            case CONFIRMED -> CommandLifecycleEvent.Kind.CONFIRMED;
            case EXPIRED -> CommandLifecycleEvent.Kind.EXPIRED;
            default -> CommandLifecycleEvent.Kind.FAILED;
        };
        emit(command, kind, resolution.failureReason().map(Enum::name).orElse("corroborated by poll"));
        store.publishOutcome(outcome);
    }

    private void emit(PendingCommand command, CommandLifecycleEvent.Kind kind, String detail) {
        sink.onCommandEvent(new CommandLifecycleEvent(
                wallClock.now(),
                command.id(),
                command.deviceId(),
                command.field(),
                command.value(),
                kind,
                command.attempts(),
                detail));
    }
}
