package com.questrail.poolheat.cloud.internal.exec;

import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.CommandId;
import com.questrail.poolheat.api.CommandOutcome;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.cloud.internal.time.Cancellable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatcher-side record of one command, doubling as the caller's handle.
 *
 * - Counts send attempts
 * - Owns the timeout and retry timers
 * - Completes exactly once
 */
final class PendingCommand implements CommandHandle
{
    private final CommandId id;
    private final DeviceId deviceId;
    private final DeviceField field;
    private final FieldValue value;
    private final long createdAtNanos;

    private final CompletableFuture<CommandOutcome> outcome = new CompletableFuture<>();
    private final AtomicInteger attempts = new AtomicInteger();

    private volatile CommandStatus status = CommandStatus.PENDING;
    private volatile Cancellable timeoutTimer = Cancellable.NONE;
    private volatile Cancellable retryTimer = Cancellable.NONE;

    PendingCommand(CommandId id, DeviceId deviceId, DeviceField field, FieldValue value, long createdAtNanos) {
        this.id = id;
        this.deviceId = deviceId;
        this.field = field;
        this.value = value;
        this.createdAtNanos = createdAtNanos;
    }

    @Override
    public CommandId id() {
        return id;
    }

    @Override
    public DeviceId deviceId() {
        return deviceId;
    }

    @Override
    public DeviceField field() {
        return field;
    }

    @Override
    public FieldValue value() {
        return value;
    }

    @Override
    public CommandStatus status() {
        return status;
    }

    @Override
    public CompletableFuture<CommandOutcome> outcome() {
        return outcome.copy();
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    int recordAttempt() {
        return attempts.incrementAndGet();
    }

    int attempts() {
        return attempts.get();
    }

    boolean isDone() {
        return status != CommandStatus.PENDING;
    }

    /**
     * A timer installed after the command completed is cancelled at once.
     */
    void setTimeoutTimer(Cancellable timer) {
        this.timeoutTimer = timer;
        if (isDone()) {
            timer.cancel();
        }
    }

    void setRetryTimer(Cancellable timer) {
        this.retryTimer = timer;
        if (isDone()) {
            timer.cancel();
        }
    }

    /**
     * Only the dispatcher's resolution path calls this, once per command.
     *
     * @return false if the command had already completed
     */
    boolean complete(CommandOutcome result) {
        if (outcome.isDone()) {
            return false;
        }
        status = result.status();
        timeoutTimer.cancel();
        retryTimer.cancel();
        return outcome.complete(result);
    }

    @Override
    public String toString() {
        return "PendingCommand[" + id + " " + field + "=" + value + " on " + deviceId + ", " + status + "]";
    }
}
