package com.archiveguard.core.events;

import java.time.Instant;

public record CollectorTickStarted(Instant timestamp, String jobType) implements Event {
    @Override
    public String type() {
        return "CollectorTickStarted";
    }
}
