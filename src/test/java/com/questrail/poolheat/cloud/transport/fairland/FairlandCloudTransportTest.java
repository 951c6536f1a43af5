package com.questrail.poolheat.cloud.transport.fairland;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.Credential;
import com.questrail.poolheat.cloud.config.FairlandEndpointConfig;
import com.questrail.poolheat.cloud.transport.Session;
import com.questrail.poolheat.cloud.transport.SessionGrant;
import com.questrail.poolheat.cloud.transport.SessionRejectedException;
import com.questrail.poolheat.cloud.transport.StateFetchResult;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import static com.questrail.poolheat.cloud.transport.fairland.FairlandCloudTransport.*;
import static com.questrail.poolheat.cloud.transport.fairland.FairlandFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FairlandCloudTransportTest {

    private static final DeviceId HP1 = DeviceId.of("hp-1");
    private static final DeviceId HP2 = DeviceId.of("hp-2");
    private static final Session SESSION = new Session("Bearer abc123", Optional.empty(), Long.MAX_VALUE);

    private final ScriptedHttpExchange http = new ScriptedHttpExchange();

    private FairlandCloudTransport transport(FairlandEndpointConfig endpoint) {
        return new FairlandCloudTransport(endpoint, http, new FairlandJsonCodec());
    }

    private FairlandCloudTransport transport() {
        return transport(FairlandEndpointConfig.builder()
                .withBaseUri(URI.create("https://cloud.example.test/"))
                .build());
    }

    @Test
    void loginPostsToLoginEndpointWithoutAuthorization() {
        http.always(LOGIN_PATH, LOGIN_OK);

        SessionGrant grant = transport().login(new Credential("pool@example.com", "s3cret"));

        assertEquals("Bearer abc123", grant.accessToken());
        ScriptedHttpExchange.Request request = http.requests().get(0);
        assertEquals(URI.create("https://cloud.example.test" + LOGIN_PATH), request.uri());
        assertEquals("2", request.headers().get("terminal"));
        assertEquals("application/json;charset=UTF-8", request.headers().get("Accept"));
        assertFalse(request.headers().containsKey("Authorization"));
    }

    @Test
    void badPasswordIsAuthenticationFailure() {
        http.always(LOGIN_PATH, LOGIN_BAD_PASSWORD);

        assertThrows(AuthenticationException.class,
                () -> transport().login(new Credential("pool@example.com", "wrong")));
    }

    @Test
    void refreshIsNotSupported() {
        assertThrows(AuthenticationException.class, () -> transport().refresh(SESSION));
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void listDevicesWalksAllGroupsAndDeduplicates() {
        http.always(GROUPS_PATH, GROUPS)
                .once(GROUP_DEVICES_PATH, HttpReply.ok(GROUP_1_DEVICES))
                .once(GROUP_DEVICES_PATH, HttpReply.ok(GROUP_2_DEVICES))
                .always(DATA_POINTS_PATH, DATA_POINTS);

        List<Device> devices = transport().listDevices(SESSION);

        assertEquals(List.of(HP1, HP2), devices.stream().map(Device::id).toList());
        assertEquals(2, http.requestsTo(DATA_POINTS_PATH).size());
        assertEquals(List.of("g-1", "g-2"), http.requestsTo(GROUP_DEVICES_PATH).stream()
                .map(r -> r.body().get("deviceGroupId").asText())
                .toList());
        assertTrue(http.requests().stream()
                .allMatch(r -> "Bearer abc123".equals(r.headers().get("Authorization"))));
    }

    @Test
    void configuredCourtyardSkipsGroupListing() {
        http.always(GROUP_DEVICES_PATH, GROUP_2_DEVICES)
                .always(DATA_POINTS_PATH, DATA_POINTS);

        List<Device> devices = transport(FairlandEndpointConfig.builder().withCourtyardId("g-2").build())
                .listDevices(SESSION);

        assertEquals(2, devices.size());
        assertTrue(http.requestsTo(GROUPS_PATH).isEmpty());
        assertEquals("g-2", http.requestsTo(GROUP_DEVICES_PATH).get(0).body().get("deviceGroupId").asText());
    }

    @Test
    void getStatesIsolatesPerDeviceFailures() {
        http.once(DATA_POINTS_PATH, HttpReply.ok(CLOUD_ERROR))
                .always(DATA_POINTS_PATH, DATA_POINTS);

        StateFetchResult result = transport().getStates(SESSION, List.of(HP1, HP2));

        assertEquals(1, result.snapshots().size());
        assertEquals(HP2, result.snapshots().get(0).deviceId());
        assertFalse(result.failures().get(HP1).isRetryable());
        assertEquals("hp-1", http.requestsTo(DATA_POINTS_PATH).get(0).body().get("deviceId").asText());
    }

    @Test
    void getStatesFailsWholeCallWhenEveryDeviceFailsRetryably() {
        http.once(DATA_POINTS_PATH, new HttpReply(503, new byte[0]))
                .onceFail(DATA_POINTS_PATH, TransportException.retryable("connect timed out", null))
                .always(DATA_POINTS_PATH, DATA_POINTS);

        TransportException e = assertThrows(TransportException.class,
                () -> transport().getStates(SESSION, List.of(HP1, HP2)));
        assertTrue(e.isRetryable());
    }

    @Test
    void rejectedSessionPropagates() {
        http.always(DATA_POINTS_PATH, new HttpReply(401, new byte[0]));

        assertThrows(SessionRejectedException.class, () -> transport().getStates(SESSION, List.of(HP1)));
    }

    @Test
    void sendCommandPostsDataPointValue() {
        http.always(SET_PATH, SET_OK);

        transport().sendCommand(SESSION, HP1, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));

        ScriptedHttpExchange.Request request = http.requestsTo(SET_PATH).get(0);
        assertEquals("hp-1", request.body().get("deviceId").asText());
        assertEquals("107", request.body().at("/dpIdValues/0/dpId").asText());
        assertEquals(30, request.body().at("/dpIdValues/0/value").asLong());
        assertEquals("Bearer abc123", request.headers().get("Authorization"));
    }

    @Test
    void cloudRefusalOfCommandIsFatal() {
        http.always(SET_PATH, CLOUD_ERROR);

        TransportException e = assertThrows(TransportException.class,
                () -> transport().sendCommand(SESSION, HP1, DeviceField.POWER, FieldValue.of(true)));
        assertFalse(e.isRetryable());
    }
}
