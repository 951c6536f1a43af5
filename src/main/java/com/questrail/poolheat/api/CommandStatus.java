package com.questrail.poolheat.api;

/**
 * Lifecycle of a command: {@code PENDING} until exactly one terminal status.
 */
public enum CommandStatus
{
    PENDING,
    CONFIRMED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
