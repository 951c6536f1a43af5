package com.questrail.poolheat.api;

/**
 * A command ended without success for a reason other than timeout or supersession.
 */
public final class CommandFailedException extends HeatPumpException
{
    private final CommandId commandId;
    private final FailureReason reason;

    public CommandFailedException(CommandId commandId, FailureReason reason, String message, Throwable cause) {
        super(commandId + " failed (" + reason + "): " + message, cause);
        this.commandId = commandId;
        this.reason = reason;
    }

    public CommandId commandId() {
        return commandId;
    }

    public FailureReason reason() {
        return reason;
    }
}
