package com.archiveguard.service.frequency;

import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.ConfigPatch;
import com.archiveguard.core.model.PerformanceImpact;
import com.archiveguard.core.model.PerformanceLevel;
import com.archiveguard.core.model.ValidationReport;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure checks for partial configuration input. Raw maps come straight from decoded JSON, so
 * values are type-checked before their ranges.
 */
public final class ConfigValidator {
    static final int SENSOR_WARNING_THRESHOLD = 10;
    static final int RFID_WARNING_THRESHOLD = 5;

    private ConfigValidator() {
    }

    /**
     * Collects every violation and soft warning.
     */
    public static ValidationReport validate(Map<String, ?> raw) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Long sensor = checkInterval(raw.get(ConfigPatch.SENSOR_INTERVAL), "Sensor interval",
                CollectionConfig.MIN_SENSOR_INTERVAL, CollectionConfig.MAX_SENSOR_INTERVAL, errors);
        if (sensor != null && sensor < SENSOR_WARNING_THRESHOLD) {
            warnings.add("Sensor interval below " + SENSOR_WARNING_THRESHOLD
                    + " seconds may affect system performance");
        }

        Long rfid = checkInterval(raw.get(ConfigPatch.RFID_INTERVAL), "RFID interval",
                CollectionConfig.MIN_RFID_INTERVAL, CollectionConfig.MAX_RFID_INTERVAL, errors);
        if (rfid != null && rfid < RFID_WARNING_THRESHOLD) {
            warnings.add("RFID interval below " + RFID_WARNING_THRESHOLD
                    + " seconds may affect system performance");
        }

        Object paused = raw.get(ConfigPatch.IS_PAUSED);
        if (paused != null && !(paused instanceof Boolean)) {
            errors.add("isPaused must be a boolean");
        }

        PerformanceImpact impact = null;
        if (sensor != null && rfid != null) {
            impact = PerformanceImpact.of(sensor.intValue(), rfid.intValue());
            if (impact.performanceLevel() == PerformanceLevel.HIGH) {
                warnings.add(impact.warning());
            }
        }
        return new ValidationReport(errors.isEmpty(), errors, warnings, impact);
    }

    public static ValidationReport validate(ConfigPatch patch) {
        return validate(patch.toMap());
    }

    /**
     * Returns the first rule the input breaks, phrased with the allowed bounds.
     */
    public static Optional<String> firstViolation(Map<String, ?> raw) {
        Object sensor = raw.get(ConfigPatch.SENSOR_INTERVAL);
        if (sensor != null && !inRange(sensor, CollectionConfig.MIN_SENSOR_INTERVAL, CollectionConfig.MAX_SENSOR_INTERVAL)) {
            return Optional.of("Sensor interval must be an integer between " + CollectionConfig.MIN_SENSOR_INTERVAL
                    + " and " + CollectionConfig.MAX_SENSOR_INTERVAL + " seconds");
        }
        Object rfid = raw.get(ConfigPatch.RFID_INTERVAL);
        if (rfid != null && !inRange(rfid, CollectionConfig.MIN_RFID_INTERVAL, CollectionConfig.MAX_RFID_INTERVAL)) {
            return Optional.of("RFID interval must be an integer between " + CollectionConfig.MIN_RFID_INTERVAL
                    + " and " + CollectionConfig.MAX_RFID_INTERVAL + " seconds");
        }
        Object paused = raw.get(ConfigPatch.IS_PAUSED);
        if (paused != null && !(paused instanceof Boolean)) {
            return Optional.of("isPaused must be a boolean");
        }
        return Optional.empty();
    }

    public static Optional<String> actorViolation(String actor) {
        if (actor != null && actor.length() > CollectionConfig.MAX_ACTOR_LENGTH) {
            return Optional.of("updatedBy must not exceed " + CollectionConfig.MAX_ACTOR_LENGTH + " characters");
        }
        return Optional.empty();
    }

    /**
     * Converts input that passed {@link #firstViolation(Map)} into a typed patch.
     */
    public static ConfigPatch toPatch(Map<String, ?> raw) {
        Long sensor = wholeNumber(raw.get(ConfigPatch.SENSOR_INTERVAL));
        Long rfid = wholeNumber(raw.get(ConfigPatch.RFID_INTERVAL));
        return new ConfigPatch(
                sensor == null ? null : Math.toIntExact(sensor),
                rfid == null ? null : Math.toIntExact(rfid),
                (Boolean) raw.get(ConfigPatch.IS_PAUSED)
        );
    }

    private static Long checkInterval(Object value, String label, int min, int max, List<String> errors) {
        if (value == null) {
            return null;
        }
        Long number = wholeNumber(value);
        if (number == null) {
            errors.add(label + " must be an integer");
            return null;
        }
        if (number < min) {
            errors.add(label + " must be at least " + min + " second" + (min == 1 ? "" : "s"));
            return null;
        }
        if (number > max) {
            errors.add(label + " must not exceed " + max + " seconds");
            return null;
        }
        return number;
    }

    private static boolean inRange(Object value, int min, int max) {
        Long number = wholeNumber(value);
        return number != null && number >= min && number <= max;
    }

    private static Long wholeNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? big.longValue() : (big.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
        }
        return null;
    }
}
