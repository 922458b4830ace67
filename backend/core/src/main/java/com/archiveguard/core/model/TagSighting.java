package com.archiveguard.core.model;

import java.time.Instant;

public record TagSighting(String tagId, String archiveId, String deviceId, String location, Instant timestamp) {
}
