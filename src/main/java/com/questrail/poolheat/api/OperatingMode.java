package com.questrail.poolheat.api;

import java.util.Optional;

/**
 * Operating mode of a heat pump ({@link DeviceField#OPERATING_MODE}).
 */
public enum OperatingMode
{
    AUTO(0),
    HEAT(1),
    COOL(2);

    private final int code;

    OperatingMode(int code) {
        this.code = code;
    }

    /**
     * Vendor wire code of this mode.
     */
    public int code() {
        return code;
    }

    public FieldValue toFieldValue() {
        return FieldValue.of(code);
    }

    public static Optional<OperatingMode> fromCode(int code) {
        for (OperatingMode mode : values()) {
            if (mode.code == code) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
