package com.archiveguard.core.events;

import java.time.Instant;

public record CollectorTickCompleted(
        Instant timestamp,
        String jobType,
        boolean success,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CollectorTickCompleted";
    }
}
