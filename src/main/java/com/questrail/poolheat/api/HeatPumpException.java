package com.questrail.poolheat.api;

/**
 * Root of every exception raised by the synchronization engine.
 */
public class HeatPumpException extends RuntimeException
{
    public HeatPumpException(String message) {
        super(message);
    }

    public HeatPumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
