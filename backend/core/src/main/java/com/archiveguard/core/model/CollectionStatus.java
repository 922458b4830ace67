package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record CollectionStatus(
        Long id,
        Instant timestamp,
        @JsonProperty("isRunning") boolean running,
        Instant sensorLastCollection,
        Instant rfidLastCollection,
        Double cpuUsage,
        Double memoryUsage,
        String errorMessage
) {
    public CollectionStatus {
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (cpuUsage != null && (cpuUsage < 0 || cpuUsage > 100)) {
            throw new IllegalArgumentException("cpuUsage must be within 0-100");
        }
        if (memoryUsage != null && memoryUsage < 0) {
            throw new IllegalArgumentException("memoryUsage must not be negative");
        }
    }

    public static CollectionStatus transition(Instant timestamp, boolean running, String errorMessage) {
        return new CollectionStatus(null, timestamp, running, null, null, null, null, errorMessage);
    }

    public CollectionStatus withId(long assignedId) {
        return new CollectionStatus(assignedId, timestamp, running, sensorLastCollection, rfidLastCollection,
                cpuUsage, memoryUsage, errorMessage);
    }
}
