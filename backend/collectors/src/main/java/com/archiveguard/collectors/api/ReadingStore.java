package com.archiveguard.collectors.api;

import com.archiveguard.core.model.RfidTag;
import com.archiveguard.core.model.SensorReading;
import com.archiveguard.core.model.TagSighting;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReadingStore {
    void putReading(SensorReading reading);

    List<RfidTag> activeTags();

    Optional<RfidTag> findTag(String tagId);

    /**
     * Moves the tag's last-seen location and time to the sighting and appends it to the
     * location history.
     */
    RfidTag recordSighting(TagSighting sighting);

    long countReadingsSince(Instant since);

    long countSightingsSince(Instant since);

    /**
     * Drops readings and sightings older than {@code cutoff}; tags are kept. Returns the number
     * of rows removed.
     */
    int pruneBefore(Instant cutoff);
}
