package com.archiveguard.service.runtime;

import com.archiveguard.core.model.CollectionError;
import com.archiveguard.core.model.ResourceUsage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the scheduler. When assembling it fails only the running and paused flags,
 * {@code error} and the timestamp are set.
 */
public record SchedulerStatus(
        @JsonProperty("isRunning") boolean running,
        @JsonProperty("isPaused") boolean paused,
        Intervals currentConfig,
        LastCollection lastCollection,
        ResourceUsage performance,
        List<CollectionError> errors,
        CollectionStatistics statistics,
        Instant timestamp,
        String error
) {
    static SchedulerStatus failed(Instant timestamp, String error) {
        return new SchedulerStatus(false, true, null, null, null, null, null, timestamp, error);
    }

    public record Intervals(int sensorInterval, int rfidInterval) {
    }

    public record LastCollection(Instant sensor, Instant rfid) {
    }
}
