package com.archiveguard.service.support;

import com.archiveguard.collectors.api.ReadingStore;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.core.model.SensorReading;
import com.archiveguard.core.model.TagSighting;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public class TestReadingStore implements ReadingStore {
    private final List<SensorReading> readings = new CopyOnWriteArrayList<>();
    private final List<TagSighting> sightings = new CopyOnWriteArrayList<>();

    @Override
    public void putReading(SensorReading reading) {
        readings.add(reading);
    }

    @Override
    public List<RfidTag> activeTags() {
        return List.of();
    }

    @Override
    public Optional<RfidTag> findTag(String tagId) {
        return Optional.empty();
    }

    @Override
    public RfidTag recordSighting(TagSighting sighting) {
        sightings.add(sighting);
        return new RfidTag(sighting.tagId(), "archive", RfidTag.STATUS_ACTIVE, sighting.archiveId(),
                sighting.location(), sighting.timestamp());
    }

    @Override
    public long countReadingsSince(Instant since) {
        return readings.stream().filter(reading -> !reading.timestamp().isBefore(since)).count();
    }

    @Override
    public long countSightingsSince(Instant since) {
        return sightings.stream().filter(sighting -> !sighting.timestamp().isBefore(since)).count();
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        int before = readings.size() + sightings.size();
        readings.removeIf(reading -> reading.timestamp().isBefore(cutoff));
        sightings.removeIf(sighting -> sighting.timestamp().isBefore(cutoff));
        return before - readings.size() - sightings.size();
    }
}
