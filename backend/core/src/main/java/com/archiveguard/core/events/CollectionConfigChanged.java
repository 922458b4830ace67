package com.archiveguard.core.events;

import com.archiveguard.core.model.CollectionConfig;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a new configuration version has been persisted and cached.
 * {@code action} is one of update, reset, pause, resume or import.
 */
public record CollectionConfigChanged(
        Instant timestamp,
        CollectionConfig oldConfig,
        CollectionConfig newConfig,
        String actor,
        String action
) implements Event {
    public CollectionConfigChanged {
        Objects.requireNonNull(oldConfig, "oldConfig is required");
        Objects.requireNonNull(newConfig, "newConfig is required");
    }

    public boolean sensorIntervalChanged() {
        return oldConfig.sensorInterval() != newConfig.sensorInterval();
    }

    public boolean rfidIntervalChanged() {
        return oldConfig.rfidInterval() != newConfig.rfidInterval();
    }

    public boolean pausedChanged() {
        return oldConfig.paused() != newConfig.paused();
    }

    @Override
    public String type() {
        return "CollectionConfigChanged";
    }
}
