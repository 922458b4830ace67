package com.archiveguard.core.events;

import java.time.Instant;

public record SensorBatchCollected(Instant timestamp, int readingCount) implements Event {
    @Override
    public String type() {
        return "SensorBatchCollected";
    }
}
