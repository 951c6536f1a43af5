package com.questrail.poolheat.cloud.transport.fairland;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.FieldCapability;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.OperatingMode;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.Credential;
import com.questrail.poolheat.cloud.config.FairlandEndpointConfig;
import com.questrail.poolheat.cloud.transport.DeviceSnapshot;
import com.questrail.poolheat.cloud.transport.SessionGrant;
import com.questrail.poolheat.cloud.transport.SessionRejectedException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FairlandJsonCodec
 * -----------------------------------------------------------------------------
 * Maps Fairland IoT cloud JSON to and from the engine's types.
 *
 * <h2>Envelope</h2>
 * Every response is {@code {"code": int, "msg": string, "data": ...}} and
 * {@code code == 200000} means success. HTTP 401/403 on a data call rejects
 * the session; 5xx is retryable; anything else that is not a success is fatal.
 *
 * <h2>Data points</h2>
 * A device reports a list of {@code {dpId, dpValue, dpMode, dpProperty}}.
 * {@code dpMode == "rw"} marks a writable point. {@code dpProperty} is itself a
 * JSON string holding either a range ({@code min}, {@code max}, {@code step},
 * {@code scale}) or a preset map of value to label.
 *
 * <h2>Faults</h2>
 * Data points with no {@link DeviceField} whose {@code dpType} or property
 * type is {@code "fault"} are read as fault flags: a non-zero or true value yields {@code "dp<ID>"} or
 * {@code "dp<ID>:<value>"}.
 */
public final class FairlandJsonCodec
{
    public static final int SUCCESS_CODE = 200000;

    private static final String HEAT_PUMP_CATEGORY = "heatPump";

    private final ObjectMapper mapper;

    public FairlandJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public FairlandJsonCodec() {
        this(new ObjectMapper());
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    public byte[] loginRequest(Credential credential, FairlandEndpointConfig endpoint) {
        ObjectNode body = mapper.createObjectNode();
        body.put("phoneCode", endpoint.phoneCode());
        body.put("accountName", credential.account());
        body.put("password", credential.secret());
        body.put("countryCode", endpoint.countryCode());
        body.put("randStr", "");
        body.put("ticket", "");
        return write(body);
    }

    public byte[] groupsRequest() {
        ObjectNode body = mapper.createObjectNode();
        body.put("needDeviceCount", true);
        return write(body);
    }

    public byte[] groupDevicesRequest(String groupId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("deviceGroupId", groupId);
        body.putNull("shareId");
        return write(body);
    }

    public byte[] dataPointsRequest(DeviceId deviceId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("deviceId", deviceId.value());
        return write(body);
    }

    public byte[] setRequest(DeviceId deviceId, DeviceField field, FieldValue value) {
        ObjectNode body = mapper.createObjectNode();
        body.put("deviceId", deviceId.value());
        ArrayNode values = body.putArray("dpIdValues");
        ObjectNode dp = values.addObject();
        dp.put("type", "");
        dp.put("dpId", field.dataPointId());
        if (value instanceof FieldValue.Switch sw) {
            dp.put("value", sw.on());
        } else {
            BigDecimal number = ((FieldValue.Number) value).value();
            if (number.scale() <= 0) {
                dp.put("value", number.longValueExact());
            } else {
                dp.put("value", number);
            }
        }
        return write(body);
    }

    // ---------------------------------------------------------------------
    // Responses
    // ---------------------------------------------------------------------

    /**
     * Validates a data-call reply and returns its {@code data} element.
     *
     * @throws SessionRejectedException on HTTP 401/403
     * @throws TransportException       for any other failure
     */
    public JsonNode unwrap(HttpReply reply, String operation) {
        if (reply.status() == 401 || reply.status() == 403) {
            throw new SessionRejectedException(operation + ": HTTP " + reply.status());
        }
        return envelope(reply, operation);
    }

    /**
     * Validates a login reply. Any rejection of the credential is an
     * {@link AuthenticationException}.
     */
    public SessionGrant parseLogin(HttpReply reply) {
        if (reply.status() == 401 || reply.status() == 403) {
            throw new AuthenticationException("login rejected: HTTP " + reply.status());
        }
        JsonNode root = parse(reply, "login");
        int code = root.path("code").asInt(-1);
        if (code != SUCCESS_CODE) {
            throw new AuthenticationException("login rejected: " + code + " " + root.path("msg").asText(""));
        }
        String token = root.path("data").path("authorization").asText("");
        if (token.isBlank()) {
            throw TransportException.fatal("login: response carries no authorization token", null);
        }
        return SessionGrant.of(token);
    }

    public List<String> parseGroupIds(JsonNode data) {
        List<String> ids = new ArrayList<>();
        for (JsonNode group : iterable(data)) {
            String id = group.path("id").asText("");
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Heat pump entries of a group listing; other device categories are skipped.
     */
    public List<JsonNode> parseGroupDevices(JsonNode data) {
        List<JsonNode> devices = new ArrayList<>();
        for (JsonNode info : iterable(data.path("bindDeviceInfos"))) {
            String category = info.path("categoryCode").asText("");
            if (HEAT_PUMP_CATEGORY.equals(category) && !info.path("id").asText("").isEmpty()) {
                devices.add(info);
            }
        }
        return devices;
    }

    public Device parseDevice(JsonNode info, JsonNode dataPoints) {
        Map<DeviceField, FieldCapability> capabilities = new EnumMap<>(DeviceField.class);
        for (JsonNode dp : iterable(dataPoints)) {
            Optional<DeviceField> field = DeviceField.forDataPoint(dp.path("dpId").asText(""));
            if (field.isEmpty()) {
                continue;
            }
            capabilities.put(field.get(), capability(field.get(), dp));
        }
        return new Device(
                DeviceId.of(info.path("id").asText()),
                info.path("deviceName").asText(""),
                info.path("categoryCode").asText(""),
                info.path("version").asText(""),
                info.path("sn").asText(""),
                capabilities);
    }

    public DeviceSnapshot parseSnapshot(DeviceId deviceId, JsonNode dataPoints) {
        Map<DeviceField, FieldValue> values = new EnumMap<>(DeviceField.class);
        Set<String> faults = new LinkedHashSet<>();
        for (JsonNode dp : iterable(dataPoints)) {
            String dpId = dp.path("dpId").asText("");
            JsonNode raw = dp.path("dpValue");
            Optional<DeviceField> field = DeviceField.forDataPoint(dpId);
            if (field.isPresent()) {
                toValue(field.get(), raw, property(dp)).ifPresent(v -> values.put(field.get(), v));
            } else if (isFaultPoint(dp)) {
                fault(dpId, raw).ifPresent(faults::add);
            }
        }
        return new DeviceSnapshot(deviceId, values, faults);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private JsonNode envelope(HttpReply reply, String operation) {
        if (reply.status() >= 500) {
            throw TransportException.retryable(operation + ": HTTP " + reply.status(), null);
        }
        if (!reply.isSuccess()) {
            throw TransportException.fatal(operation + ": HTTP " + reply.status(), null);
        }
        JsonNode root = parse(reply, operation);
        int code = root.path("code").asInt(-1);
        if (code != SUCCESS_CODE) {
            throw TransportException.fatal(operation + ": cloud error " + code + " " + root.path("msg").asText(""), null);
        }
        return root.path("data");
    }

    private JsonNode parse(HttpReply reply, String operation) {
        if (reply.status() >= 500) {
            throw TransportException.retryable(operation + ": HTTP " + reply.status(), null);
        }
        try {
            JsonNode root = mapper.readTree(reply.body());
            if (root == null || !root.isObject()) {
                throw TransportException.fatal(operation + ": response is not a JSON object", null);
            }
            return root;
        } catch (IOException e) {
            throw TransportException.fatal(operation + ": malformed JSON", e);
        }
    }

    /**
     * Capability of one data point: the field's default limits, overridden
     * bound by bound by whatever the point's {@code dpProperty} states. A
     * descriptor listing named values instead of bounds yields presets.
     */
    private FieldCapability capability(DeviceField field, JsonNode dp) {
        boolean writable = field.isWritable() && "rw".equals(dp.path("dpMode").asText(""));
        if (!writable) {
            return FieldCapability.readOnly();
        }
        JsonNode property = property(dp);
        FieldCapability capability;
        if (property.has("min") || property.has("max") || property.has("step")) {
            capability = bounded(field.defaultCapability(), property);
        } else {
            Map<Integer, String> presets = presets(property);
            capability = presets.isEmpty() ? field.defaultCapability() : FieldCapability.writablePresets(presets);
        }
        return field == DeviceField.OPERATING_MODE ? operatingModes(capability) : capability;
    }

    private static FieldCapability bounded(FieldCapability defaults, JsonNode property) {
        Optional<BigDecimal> statedMin = decimal(property.get("min"));
        Optional<BigDecimal> statedMax = decimal(property.get("max"));
        Optional<BigDecimal> step = decimal(property.get("step")).filter(s -> s.signum() > 0);
        if (statedMin.isPresent() && statedMax.isPresent() && statedMin.get().compareTo(statedMax.get()) > 0) {
            statedMin = Optional.empty();
            statedMax = Optional.empty();
        }

        Optional<BigDecimal> min = statedMin.isPresent() ? statedMin : defaults.min();
        Optional<BigDecimal> max = statedMax.isPresent() ? statedMax : defaults.max();
        if (min.isPresent() && max.isPresent() && min.get().compareTo(max.get()) > 0) {
            // a stated bound wins over the default it contradicts
            if (statedMin.isPresent()) {
                max = statedMax;
            } else {
                min = statedMin;
            }
        }
        return new FieldCapability(true, min, max, step.isPresent() ? step : defaults.step(), Map.of());
    }

    /**
     * Operating mode only ever takes the {@link OperatingMode} codes, further
     * narrowed by what the device itself accepts.
     */
    private static FieldCapability operatingModes(FieldCapability device) {
        Map<Integer, String> modes = new LinkedHashMap<>();
        for (OperatingMode mode : OperatingMode.values()) {
            if (device.violation(mode.toFieldValue()).isEmpty()) {
                modes.put(mode.code(), mode.name());
            }
        }
        if (modes.isEmpty()) {
            for (OperatingMode mode : OperatingMode.values()) {
                modes.put(mode.code(), mode.name());
            }
        }
        return FieldCapability.writablePresets(modes);
    }

    private static Map<Integer, String> presets(JsonNode property) {
        Map<Integer, String> presets = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = property.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            try {
                presets.put(Integer.parseInt(entry.getKey().trim()), entry.getValue().asText());
            } catch (NumberFormatException e) {
                return Map.of();
            }
        }
        return presets;
    }

    /**
     * Parses the nested {@code dpProperty} JSON string; an unreadable property
     * is treated as absent.
     */
    private JsonNode property(JsonNode dp) {
        JsonNode raw = dp.path("dpProperty");
        if (raw.isObject()) {
            return raw;
        }
        String text = raw.asText("");
        if (text.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode parsed = mapper.readTree(text);
            return parsed != null && parsed.isObject() ? parsed : mapper.createObjectNode();
        } catch (JsonProcessingException e) {
            return mapper.createObjectNode();
        }
    }

    private static Optional<FieldValue> toValue(DeviceField field, JsonNode raw, JsonNode property) {
        if (raw.isMissingNode() || raw.isNull()) {
            return Optional.empty();
        }
        if (field.kind() == DeviceField.Kind.SWITCH) {
            if (raw.isBoolean()) {
                return Optional.of(FieldValue.of(raw.booleanValue()));
            }
            String text = raw.asText("").trim();
            if ("true".equalsIgnoreCase(text) || "1".equals(text)) {
                return Optional.of(FieldValue.of(true));
            }
            if ("false".equalsIgnoreCase(text) || "0".equals(text)) {
                return Optional.of(FieldValue.of(false));
            }
            return Optional.empty();
        }

        Optional<BigDecimal> number = decimal(raw);
        if (number.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal value = number.get();
        if (field == DeviceField.POWER_DRAW) {
            int scale = property.path("scale").asInt(0);
            if (scale > 0) {
                value = value.movePointLeft(scale);
            }
        }
        return Optional.of(FieldValue.of(value));
    }

    private boolean isFaultPoint(JsonNode dp) {
        return "fault".equalsIgnoreCase(dp.path("dpType").asText(""))
                || "fault".equalsIgnoreCase(property(dp).path("type").asText(""));
    }

    private static Optional<String> fault(String dpId, JsonNode raw) {
        if (raw.isBoolean()) {
            return raw.booleanValue() ? Optional.of("dp" + dpId) : Optional.empty();
        }
        Optional<BigDecimal> number = decimal(raw);
        if (number.isPresent()) {
            return number.get().signum() == 0
                    ? Optional.empty()
                    : Optional.of("dp" + dpId + ":" + number.get().stripTrailingZeros().toPlainString());
        }
        String text = raw.asText("").trim();
        return text.isEmpty() || "false".equalsIgnoreCase(text) ? Optional.empty() : Optional.of("dp" + dpId + ":" + text);
    }

    private static Optional<BigDecimal> decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        String text = node.asText("").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Iterable<JsonNode> iterable(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private byte[] write(JsonNode body) {
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw TransportException.fatal("cannot encode request", e);
        }
    }
}
