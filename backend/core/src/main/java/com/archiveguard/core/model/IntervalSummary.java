package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IntervalSummary(int sensorInterval, int rfidInterval, @JsonProperty("isPaused") boolean paused) {
    public static IntervalSummary of(CollectionConfig config) {
        return new IntervalSummary(config.sensorInterval(), config.rfidInterval(), config.paused());
    }
}
