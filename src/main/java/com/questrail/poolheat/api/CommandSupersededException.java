package com.questrail.poolheat.api;

/**
 * A later command for the same device field replaced this one before it resolved.
 */
public final class CommandSupersededException extends HeatPumpException
{
    private final CommandId commandId;

    public CommandSupersededException(CommandId commandId) {
        super(commandId + ": superseded by a later command");
        this.commandId = commandId;
    }

    public CommandId commandId() {
        return commandId;
    }
}
