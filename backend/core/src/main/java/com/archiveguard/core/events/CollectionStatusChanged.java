package com.archiveguard.core.events;

import java.time.Instant;

public record CollectionStatusChanged(Instant timestamp, String status, String actor) implements Event {
    public static final String PAUSED = "paused";
    public static final String RESUMED = "resumed";

    public boolean isPaused() {
        return PAUSED.equals(status);
    }

    public boolean isResumed() {
        return RESUMED.equals(status);
    }

    @Override
    public String type() {
        return "CollectionStatusChanged";
    }
}
