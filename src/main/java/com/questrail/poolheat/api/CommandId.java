package com.questrail.poolheat.api;

/**
 * Identifier of one issued command. Unique within a controller instance and
 * increasing in issue order.
 */
public record CommandId(long sequence)
{
    @Override
    public String toString() {
        return "cmd-" + sequence;
    }
}
