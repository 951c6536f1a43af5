package com.questrail.poolheat.api;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CommandHandle
 * -----------------------------------------------------------------------------
 * Caller-side view of an issued command.
 *
 * <p>{@link #outcome()} always completes normally, with the terminal
 * {@link CommandOutcome}. {@link #await(Duration)} is the convenience form that
 * turns a non-confirmed outcome into the matching exception.</p>
 */
public interface CommandHandle
{
    CommandId id();

    DeviceId deviceId();

    DeviceField field();

    FieldValue value();

    /**
     * Current status; {@link CommandStatus#PENDING} until the outcome is known.
     */
    CommandStatus status();

    CompletableFuture<CommandOutcome> outcome();

    /**
     * Blocks until the command reaches a terminal status or {@code timeout} elapses.
     *
     * @return the outcome, if the command was confirmed
     * @throws CommandTimeoutException    if the command expired, or the wait itself timed out
     * @throws CommandSupersededException if a later command replaced this one
     * @throws CommandFailedException     for any other failure
     */
    default CommandOutcome await(Duration timeout) {
        CommandOutcome result;
        try {
            result = outcome().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new CommandTimeoutException(id(), "no outcome within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandFailedException(id(), FailureReason.SHUTDOWN, "interrupted while waiting", e);
        } catch (ExecutionException e) {
            throw new CommandFailedException(id(), FailureReason.FATAL_TRANSPORT, "outcome failed", e.getCause());
        }

        if (result.isConfirmed()) {
            return result;
        }
        FailureReason reason = result.failureReason().orElseThrow();
        switch (reason) {
            case TIMEOUT:
                throw new CommandTimeoutException(id(), "not corroborated by polling");
            case SUPERSEDED:
                throw new CommandSupersededException(id());
            default:
                throw new CommandFailedException(id(), reason, "command " + result.status(), null);
        }
    }
}
