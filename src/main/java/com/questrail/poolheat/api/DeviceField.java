package com.questrail.poolheat.api;

import java.util.Optional;

/**
 * DeviceField
 * -----------------------------------------------------------------------------
 * Closed set of operational parameters the engine tracks for a heat pump.
 *
 * <p>Each field maps to one vendor data point. {@link #isWritable()} states
 * whether the field can ever be commanded; whether a particular device accepts
 * writes to it is decided by that device's {@link FieldCapability}, which
 * starts from {@link #defaultCapability()}.</p>
 */
public enum DeviceField
{
    POWER("101", Kind.SWITCH, true),
    RUNNING_MODE("102", Kind.NUMBER, true),
    INLET_WATER_TEMPERATURE("103", Kind.NUMBER, false),
    RUNNING_PERCENTAGE("105", Kind.NUMBER, false),
    OPERATING_MODE("106", Kind.NUMBER, true, 0, 2, 1),
    TARGET_TEMPERATURE("107", Kind.NUMBER, true, 8, 40, 1),
    LOWER_TEMPERATURE_LIMIT("108", Kind.NUMBER, false),
    UPPER_TEMPERATURE_LIMIT("109", Kind.NUMBER, false),
    POWER_DRAW("112", Kind.NUMBER, false),
    OPERATING_STATUS("113", Kind.NUMBER, false),
    WATER_PUMP_MODE("116", Kind.NUMBER, true, 0, 2, 1),
    WATER_PUMP_TIME("117", Kind.NUMBER, true, 10, 120, 5),
    DEFROST_INTERVAL("118", Kind.NUMBER, true, 30, 90, 1),
    DEFROST_START_TEMPERATURE("119", Kind.NUMBER, true, -30, 250, 1),
    DEFROST_RUNNING_TIME("120", Kind.NUMBER, true, 1, 12, 1),
    DEFROST_QUIT_TEMPERATURE("121", Kind.NUMBER, true, 8, 100, 1),
    OUTLET_WATER_TEMPERATURE("129", Kind.NUMBER, false),
    AMBIENT_TEMPERATURE("130", Kind.NUMBER, false),
    EXHAUST_TEMPERATURE("131", Kind.NUMBER, false),
    DC_FAN_SPEED("137", Kind.NUMBER, false);

    /**
     * Shape of the value a field carries.
     */
    public enum Kind {
        SWITCH,
        NUMBER
    }

    private final String dataPointId;
    private final Kind kind;
    private final boolean writable;
    private final FieldCapability defaultCapability;

    DeviceField(String dataPointId, Kind kind, boolean writable) {
        this.dataPointId = dataPointId;
        this.kind = kind;
        this.writable = writable;
        this.defaultCapability = writable ? FieldCapability.writableUnbounded() : FieldCapability.readOnly();
    }

    DeviceField(String dataPointId, Kind kind, boolean writable, long min, long max, long step) {
        this.dataPointId = dataPointId;
        this.kind = kind;
        this.writable = writable;
        this.defaultCapability = FieldCapability.writableRange(min, max, step);
    }

    public String dataPointId() {
        return dataPointId;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isWritable() {
        return writable;
    }

    /**
     * Limits that apply when a device's data point descriptor does not state
     * its own. A device may narrow or widen any of them individually.
     */
    public FieldCapability defaultCapability() {
        return defaultCapability;
    }

    /**
     * Returns {@code true} if {@code value} has the shape this field carries.
     */
    public boolean accepts(FieldValue value) {
        return switch (kind) {
            case SWITCH -> value instanceof FieldValue.Switch;
            case NUMBER -> value instanceof FieldValue.Number;
        };
    }

    public static Optional<DeviceField> forDataPoint(String dataPointId) {
        for (DeviceField field : values()) {
            if (field.dataPointId.equals(dataPointId)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
