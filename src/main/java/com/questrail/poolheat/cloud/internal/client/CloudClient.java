package com.questrail.poolheat.cloud.internal.client;

import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.HeatPumpException;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.internal.session.SessionManager;
import com.questrail.poolheat.cloud.transport.CloudTransport;
import com.questrail.poolheat.cloud.transport.Session;
import com.questrail.poolheat.cloud.transport.SessionRejectedException;
import com.questrail.poolheat.cloud.transport.StateFetchResult;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Session-aware front of a {@link CloudTransport}.
 *
 * <p>Attaches the current session to every call. If the cloud rejects the
 * session, it is invalidated and the call is repeated exactly once with a
 * fresh one; a second rejection is fatal. Retryable transport errors are
 * passed through untouched; retrying them is the caller's decision.</p>
 */
public final class CloudClient
{
    private final CloudTransport transport;
    private final SessionManager sessions;

    public CloudClient(CloudTransport transport, SessionManager sessions) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    public List<Device> listDevices() {
        return call("listDevices", transport::listDevices);
    }

    public StateFetchResult getStates(Collection<DeviceId> deviceIds) {
        Objects.requireNonNull(deviceIds, "deviceIds");
        return call("getStates", session -> transport.getStates(session, deviceIds));
    }

    public void sendCommand(DeviceId deviceId, DeviceField field, FieldValue value) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        call("sendCommand", session -> {
            transport.sendCommand(session, deviceId, field, value);
            return null;
        });
    }

    private <T> T call(String operation, Function<Session, T> action) {
        Session session = sessions.currentSession();
        try {
            return invoke(operation, action, session);
        } catch (SessionRejectedException first) {
            sessions.invalidate(session);
        }

        Session renewed = sessions.currentSession();
        try {
            return invoke(operation, action, renewed);
        } catch (SessionRejectedException second) {
            sessions.invalidate(renewed);
            throw TransportException.fatal(operation + ": session rejected after renewal", second);
        }
    }

    private static <T> T invoke(String operation, Function<Session, T> action, Session session) {
        try {
            return action.apply(session);
        } catch (HeatPumpException e) {
            throw e;
        } catch (RuntimeException e) {
            throw TransportException.fatal(operation + ": unexpected transport failure", e);
        }
    }
}
