package com.questrail.poolheat.cloud.transport.fairland;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.Credential;
import com.questrail.poolheat.cloud.config.FairlandEndpointConfig;
import com.questrail.poolheat.cloud.transport.CloudTransport;
import com.questrail.poolheat.cloud.transport.DeviceSnapshot;
import com.questrail.poolheat.cloud.transport.Session;
import com.questrail.poolheat.cloud.transport.SessionGrant;
import com.questrail.poolheat.cloud.transport.SessionRejectedException;
import com.questrail.poolheat.cloud.transport.StateFetchResult;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * FairlandCloudTransport
 * =============================================================================
 * {@link CloudTransport} binding for the Fairland IoT cloud (HTTPS + JSON).
 *
 * <h2>Architectural Role</h2>
 * Pure request/response adapter: builds the vendor request, performs one
 * exchange, classifies the reply. It holds no session state and never retries.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code /fyld-user-api/user/loginByPassword}</li>
 *   <li>{@code /fyld-device-api/deviceGroupApi/allGroupInfo}</li>
 *   <li>{@code /fyld-device-api/deviceApi/deviceAllGroupInfo}</li>
 *   <li>{@code /fyld-device-api/deviceDataPointApi/deviceDataPointInfo}</li>
 *   <li>{@code /fyld-device-api/devicePropertySetApi/set}</li>
 * </ul>
 *
 * The cloud has no batch status call, so {@link #getStates} fetches one device
 * at a time and isolates per-device failures. It issues no refresh tokens;
 * {@link #refresh} always rejects so the session manager logs in again.
 */
public final class FairlandCloudTransport implements CloudTransport
{
    static final String LOGIN_PATH = "/fyld-user-api/user/loginByPassword";
    static final String GROUPS_PATH = "/fyld-device-api/deviceGroupApi/allGroupInfo";
    static final String GROUP_DEVICES_PATH = "/fyld-device-api/deviceApi/deviceAllGroupInfo";
    static final String DATA_POINTS_PATH = "/fyld-device-api/deviceDataPointApi/deviceDataPointInfo";
    static final String SET_PATH = "/fyld-device-api/devicePropertySetApi/set";

    private final FairlandEndpointConfig endpoint;
    private final HttpExchange http;
    private final FairlandJsonCodec codec;

    public FairlandCloudTransport(FairlandEndpointConfig endpoint, HttpExchange http, FairlandJsonCodec codec) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public SessionGrant login(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        HttpReply reply = http.post(uri(LOGIN_PATH), baseHeaders(), codec.loginRequest(credential, endpoint));
        return codec.parseLogin(reply);
    }

    @Override
    public SessionGrant refresh(Session session) {
        throw new AuthenticationException("Fairland sessions cannot be refreshed");
    }

    @Override
    public List<Device> listDevices(Session session) {
        Objects.requireNonNull(session, "session");
        List<String> groupIds = endpoint.courtyardId()
                .map(List::of)
                .orElseGet(() -> codec.parseGroupIds(call(session, GROUPS_PATH, codec.groupsRequest(), "listGroups")));

        Set<String> seen = new LinkedHashSet<>();
        List<Device> devices = new ArrayList<>();
        for (String groupId : groupIds) {
            JsonNode group = call(session, GROUP_DEVICES_PATH, codec.groupDevicesRequest(groupId), "listDevices");
            for (JsonNode info : codec.parseGroupDevices(group)) {
                DeviceId id = DeviceId.of(info.path("id").asText());
                if (seen.add(id.value())) {
                    devices.add(codec.parseDevice(info, dataPoints(session, id)));
                }
            }
        }
        return devices;
    }

    @Override
    public StateFetchResult getStates(Session session, Collection<DeviceId> deviceIds) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(deviceIds, "deviceIds");

        List<DeviceSnapshot> snapshots = new ArrayList<>();
        Map<DeviceId, TransportException> failures = new LinkedHashMap<>();
        TransportException lastRetryable = null;

        for (DeviceId id : deviceIds) {
            try {
                snapshots.add(codec.parseSnapshot(id, dataPoints(session, id)));
            } catch (TransportException e) {
                failures.put(id, e);
                if (e.isRetryable()) {
                    lastRetryable = e;
                }
            }
        }

        // Every device failed and at least one retryably: the call as a whole failed.
        if (snapshots.isEmpty() && lastRetryable != null && failures.size() == deviceIds.size()) {
            throw lastRetryable;
        }
        return new StateFetchResult(snapshots, failures);
    }

    @Override
    public void sendCommand(Session session, DeviceId deviceId, DeviceField field, FieldValue value) {
        Objects.requireNonNull(session, "session");
        call(session, SET_PATH, codec.setRequest(deviceId, field, value), "sendCommand");
    }

    private JsonNode dataPoints(Session session, DeviceId deviceId) {
        return call(session, DATA_POINTS_PATH, codec.dataPointsRequest(deviceId), "getState " + deviceId);
    }

    /**
     * @throws SessionRejectedException if the cloud refuses the session
     */
    private JsonNode call(Session session, String path, byte[] body, String operation) {
        Map<String, String> headers = baseHeaders();
        headers.put("Authorization", session.accessToken());
        return codec.unwrap(http.post(uri(path), headers, body), operation);
    }

    private URI uri(String path) {
        String base = endpoint.baseUri().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static Map<String, String> baseHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json;charset=UTF-8");
        headers.put("terminal", "2");
        headers.put("User-Agent", "Dart/3.5 (dart:io)");
        return headers;
    }
}
