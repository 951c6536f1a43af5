package com.questrail.poolheat.cloud.transport;

import com.questrail.poolheat.api.HeatPumpException;

/**
 * Thrown by a {@link CloudTransport} data call when the cloud refuses the
 * session it was given (expired or revoked token).
 */
public class SessionRejectedException extends HeatPumpException
{
    public SessionRejectedException(String message) {
        super(message);
    }
}
