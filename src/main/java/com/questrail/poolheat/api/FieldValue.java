package com.questrail.poolheat.api;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * FieldValue
 * -----------------------------------------------------------------------------
 * Value carried by a single {@link DeviceField}.
 *
 * <p>The cloud exposes every data point either as a boolean switch or as a
 * number. Numbers are normalised on construction so that {@code 30} and
 * {@code 30.0} are equal; corroboration of a command compares values with
 * {@link #equals(Object)}.</p>
 */
public sealed interface FieldValue
        permits FieldValue.Switch, FieldValue.Number
{
    static FieldValue of(boolean on) {
        return on ? Switch.ON : Switch.OFF;
    }

    static FieldValue of(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static FieldValue of(BigDecimal value) {
        return new Number(value);
    }

    /**
     * Boolean data point (power, enable flags).
     */
    record Switch(boolean on) implements FieldValue {
        public static final Switch ON = new Switch(true);
        public static final Switch OFF = new Switch(false);

        @Override
        public String toString() {
            return on ? "on" : "off";
        }
    }

    /**
     * Numeric data point. Scale is stripped so equality is numeric equality.
     */
    record Number(BigDecimal value) implements FieldValue {
        public Number {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        public int intValueExact() {
            return value.intValueExact();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }
}
