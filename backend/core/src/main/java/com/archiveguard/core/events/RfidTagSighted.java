package com.archiveguard.core.events;

import java.time.Instant;

public record RfidTagSighted(
        Instant timestamp,
        String tagId,
        String deviceId,
        String location
) implements Event {
    @Override
    public String type() {
        return "RfidTagSighted";
    }
}
