package com.questrail.poolheat.api;

/**
 * A command was not corroborated by polling in time. The cloud may have
 * accepted it; the device did not demonstrably reach the requested value.
 */
public final class CommandTimeoutException extends HeatPumpException
{
    private final CommandId commandId;

    public CommandTimeoutException(CommandId commandId, String message) {
        super(commandId + ": " + message);
        this.commandId = commandId;
    }

    public CommandId commandId() {
        return commandId;
    }
}
