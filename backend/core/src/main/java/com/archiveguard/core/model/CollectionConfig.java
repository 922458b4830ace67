package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One immutable version of the collection configuration. New versions are derived with
 * {@link #apply(ConfigPatch, String, Instant)}; the store assigns {@code id} on insert.
 */
@JsonIgnoreProperties(value = "performanceImpact", allowGetters = true)
public record CollectionConfig(
        Long id,
        int sensorInterval,
        int rfidInterval,
        @JsonProperty("isPaused") boolean paused,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_SENSOR_INTERVAL = 30;
    public static final int DEFAULT_RFID_INTERVAL = 10;
    public static final int MIN_SENSOR_INTERVAL = 1;
    public static final int MAX_SENSOR_INTERVAL = 300;
    public static final int MIN_RFID_INTERVAL = 1;
    public static final int MAX_RFID_INTERVAL = 60;
    public static final int MAX_ACTOR_LENGTH = 100;
    public static final String SYSTEM_ACTOR = "system";

    public CollectionConfig {
        if (sensorInterval < MIN_SENSOR_INTERVAL || sensorInterval > MAX_SENSOR_INTERVAL) {
            throw new IllegalArgumentException("sensorInterval must be between "
                    + MIN_SENSOR_INTERVAL + " and " + MAX_SENSOR_INTERVAL + " seconds");
        }
        if (rfidInterval < MIN_RFID_INTERVAL || rfidInterval > MAX_RFID_INTERVAL) {
            throw new IllegalArgumentException("rfidInterval must be between "
                    + MIN_RFID_INTERVAL + " and " + MAX_RFID_INTERVAL + " seconds");
        }
        updatedBy = updatedBy == null || updatedBy.isBlank() ? SYSTEM_ACTOR : updatedBy;
        if (updatedBy.length() > MAX_ACTOR_LENGTH) {
            throw new IllegalArgumentException("updatedBy must not exceed " + MAX_ACTOR_LENGTH + " characters");
        }
    }

    public static CollectionConfig defaults(String actor, Instant at) {
        return new CollectionConfig(null, DEFAULT_SENSOR_INTERVAL, DEFAULT_RFID_INTERVAL, false, actor, at, at);
    }

    public CollectionConfig apply(ConfigPatch patch, String actor, Instant at) {
        return new CollectionConfig(
                null,
                patch.sensorInterval() == null ? sensorInterval : patch.sensorInterval(),
                patch.rfidInterval() == null ? rfidInterval : patch.rfidInterval(),
                patch.paused() == null ? paused : patch.paused(),
                actor,
                at,
                at
        );
    }

    public CollectionConfig withId(long assignedId) {
        return new CollectionConfig(assignedId, sensorInterval, rfidInterval, paused, updatedBy, createdAt, updatedAt);
    }

    @JsonProperty("performanceImpact")
    public PerformanceImpact performanceImpact() {
        return PerformanceImpact.of(sensorInterval, rfidInterval);
    }
}
