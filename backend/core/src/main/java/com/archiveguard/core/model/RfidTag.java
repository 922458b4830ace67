package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

public record RfidTag(
        String tagId,
        String tagType,
        String status,
        String archiveId,
        String lastSeenLocation,
        Instant lastSeenTime
) {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";

    public RfidTag {
        Objects.requireNonNull(tagId, "tagId is required");
        status = status == null ? STATUS_ACTIVE : status;
    }

    @JsonIgnore
    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }

    public RfidTag seenAt(String location, Instant at) {
        return new RfidTag(tagId, tagType, status, archiveId, location, at);
    }
}
