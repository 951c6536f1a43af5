package com.questrail.poolheat.api;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FieldCapability
 * -----------------------------------------------------------------------------
 * What a particular device supports for one {@link DeviceField}.
 *
 * <p>Derived at discovery time from the data point's access mode and property
 * descriptor. Ranges and steps are optional; when absent any value of the right
 * shape is accepted. Presets, when present, are the only legal values.</p>
 */
public record FieldCapability(
        boolean writable,
        Optional<BigDecimal> min,
        Optional<BigDecimal> max,
        Optional<BigDecimal> step,
        Map<Integer, String> presets
) {
    public FieldCapability {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(presets, "presets");
        presets = Collections.unmodifiableMap(new LinkedHashMap<>(presets));

        if (min.isPresent() && max.isPresent() && min.get().compareTo(max.get()) > 0) {
            throw new IllegalArgumentException("min must be <= max");
        }
        if (step.isPresent() && step.get().signum() <= 0) {
            throw new IllegalArgumentException("step must be positive");
        }
    }

    public static FieldCapability readOnly() {
        return new FieldCapability(false, Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
    }

    public static FieldCapability writableUnbounded() {
        return new FieldCapability(true, Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
    }

    public static FieldCapability writableRange(long min, long max, long step) {
        return new FieldCapability(
                true,
                Optional.of(BigDecimal.valueOf(min)),
                Optional.of(BigDecimal.valueOf(max)),
                Optional.of(BigDecimal.valueOf(step)),
                Map.of());
    }

    public static FieldCapability writablePresets(Map<Integer, String> presets) {
        return new FieldCapability(true, Optional.empty(), Optional.empty(), Optional.empty(), presets);
    }

    /**
     * Checks a candidate value against this capability.
     *
     * @return empty if acceptable, otherwise a human-readable rejection reason
     */
    public Optional<String> violation(FieldValue value) {
        if (!writable) {
            return Optional.of("field is read-only on this device");
        }
        if (!(value instanceof FieldValue.Number number)) {
            return Optional.empty();
        }
        BigDecimal v = number.value();
        if (!presets.isEmpty()) {
            boolean known;
            try {
                known = presets.containsKey(v.intValueExact());
            } catch (ArithmeticException e) {
                known = false;
            }
            return known ? Optional.empty() : Optional.of("value " + v.toPlainString() + " is not a known preset " + presets.keySet());
        }
        if (min.isPresent() && v.compareTo(min.get()) < 0) {
            return Optional.of("value " + v.toPlainString() + " is below minimum " + min.get().toPlainString());
        }
        if (max.isPresent() && v.compareTo(max.get()) > 0) {
            return Optional.of("value " + v.toPlainString() + " is above maximum " + max.get().toPlainString());
        }
        if (step.isPresent()) {
            BigDecimal origin = min.orElse(BigDecimal.ZERO);
            if (v.subtract(origin).remainder(step.get()).signum() != 0) {
                return Optional.of("value " + v.toPlainString() + " is not a multiple of step " + step.get().toPlainString());
            }
        }
        return Optional.empty();
    }
}
