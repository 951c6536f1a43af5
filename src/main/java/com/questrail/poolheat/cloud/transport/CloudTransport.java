package com.questrail.poolheat.cloud.transport;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.Credential;

import java.util.Collection;
import java.util.List;

/**
 * CloudTransport
 * -----------------------------------------------------------------------------
 * Port to a vendor cloud API. One blocking request/response per call.
 *
 * <h2>Error contract</h2>
 * <ul>
 *   <li>{@link AuthenticationException}: {@link #login} or {@link #refresh}
 *       rejected the credential or refresh token.</li>
 *   <li>{@link SessionRejectedException}: a data call was refused because of
 *       the session; the caller may renew the session and retry once.</li>
 *   <li>{@link TransportException} {@code RETRYABLE}: transient failure
 *       (timeout, connection error, server error).</li>
 *   <li>{@link TransportException} {@code FATAL}: the request can never
 *       succeed as formed.</li>
 * </ul>
 *
 * Implementations perform no retries of their own.
 */
public interface CloudTransport
{
    SessionGrant login(Credential credential);

    /**
     * Renews a session. Only called for sessions that carry a refresh token.
     */
    SessionGrant refresh(Session session);

    /**
     * Lists every device visible to the session, with capabilities.
     */
    List<Device> listDevices(Session session);

    /**
     * Fetches current values for the given devices. A failure confined to one
     * device is reported in {@link StateFetchResult#failures()}; a failure of
     * the call as a whole is thrown.
     */
    StateFetchResult getStates(Session session, Collection<DeviceId> deviceIds);

    /**
     * Sends a write. Returning normally means the cloud accepted the request,
     * not that the device applied it.
     */
    void sendCommand(Session session, DeviceId deviceId, DeviceField field, FieldValue value);
}
