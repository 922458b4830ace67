package com.archiveguard.service.store;

import com.archiveguard.collectors.api.ReadingStore;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.core.model.SensorReading;
import com.archiveguard.core.model.TagSighting;
import com.archiveguard.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collected data on disk: sensor readings and tag sightings as JSONL, tags as a JSON snapshot
 * seeded on first start.
 *
 * <p>Row timestamps are indexed in memory once at startup, so counting never rereads the files.
 * {@link #pruneBefore(Instant)} bounds both the files and the index.
 */
public class JsonFileReadingStore implements ReadingStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path readingsFile;
    private final Path sightingsFile;
    private final Path tagsFile;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RfidTag> tags = new LinkedHashMap<>();
    private final NavigableMap<Instant, Integer> readingTimes = new TreeMap<>();
    private final NavigableMap<Instant, Integer> sightingTimes = new TreeMap<>();

    public JsonFileReadingStore(Path dataDir, List<RfidTag> seedTags) {
        this.readingsFile = dataDir.resolve("environment_data.jsonl");
        this.sightingsFile = dataDir.resolve("location_history.jsonl");
        this.tagsFile = dataDir.resolve("rfid_tags.json");
        loadTags(seedTags);
        lock.lock();
        try {
            indexTimestamps(readingsFile, readingTimes);
            indexTimestamps(sightingsFile, sightingTimes);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putReading(SensorReading reading) {
        lock.lock();
        try {
            appendLine(readingsFile, reading);
            readingTimes.merge(reading.timestamp(), 1, Integer::sum);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<RfidTag> activeTags() {
        lock.lock();
        try {
            return tags.values().stream().filter(RfidTag::isActive).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RfidTag> findTag(String tagId) {
        lock.lock();
        try {
            return Optional.ofNullable(tags.get(tagId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RfidTag recordSighting(TagSighting sighting) {
        lock.lock();
        try {
            RfidTag current = tags.get(sighting.tagId());
            if (current == null) {
                throw new IllegalArgumentException("Unknown RFID tag: " + sighting.tagId());
            }
            RfidTag updated = current.seenAt(sighting.location(), sighting.timestamp());
            Map<String, RfidTag> next = new LinkedHashMap<>(tags);
            next.put(updated.tagId(), updated);
            appendLine(sightingsFile, sighting);
            sightingTimes.merge(sighting.timestamp(), 1, Integer::sum);
            persistTags(next);
            tags.put(updated.tagId(), updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long countReadingsSince(Instant since) {
        return countSince(readingTimes, since);
    }

    @Override
    public long countSightingsSince(Instant since) {
        return countSince(sightingTimes, since);
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        lock.lock();
        try {
            return prune(readingsFile, readingTimes, cutoff) + prune(sightingsFile, sightingTimes, cutoff);
        } finally {
            lock.unlock();
        }
    }

    private long countSince(NavigableMap<Instant, Integer> times, Instant since) {
        lock.lock();
        try {
            long count = 0;
            for (int rows : times.tailMap(since, true).values()) {
                count += rows;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private int prune(Path file, NavigableMap<Instant, Integer> times, Instant cutoff) {
        NavigableMap<Instant, Integer> expired = times.headMap(cutoff, false);
        if (expired.isEmpty()) {
            return 0;
        }
        int dropped = 0;
        for (int rows : expired.values()) {
            dropped += rows;
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                 BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    Instant timestamp = timestampOf(line);
                    if (timestamp != null && !timestamp.isBefore(cutoff)) {
                        writer.write(line);
                        writer.newLine();
                    }
                }
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed pruning " + file, e);
        }
        expired.clear();
        return dropped;
    }

    // Caller holds the lock.
    private void indexTimestamps(Path file, NavigableMap<Instant, Integer> times) {
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                Instant timestamp = timestampOf(line);
                if (timestamp != null) {
                    times.merge(timestamp, 1, Integer::sum);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed indexing rows in " + file, e);
        }
    }

    private static Instant timestampOf(String line) throws IOException {
        if (line.isBlank()) {
            return null;
        }
        JsonNode timestamp = MAPPER.readTree(line).path("timestamp");
        return timestamp.isTextual() ? Instant.parse(timestamp.asText()) : null;
    }

    private void loadTags(List<RfidTag> seedTags) {
        lock.lock();
        try {
            if (Files.exists(tagsFile)) {
                try (InputStream in = Files.newInputStream(tagsFile)) {
                    List<RfidTag> loaded = MAPPER.readValue(in, new TypeReference<List<RfidTag>>() {
                    });
                    loaded.forEach(tag -> tags.put(tag.tagId(), tag));
                }
                return;
            }
            seedTags.forEach(tag -> tags.put(tag.tagId(), tag));
            if (!tags.isEmpty()) {
                persistTags(tags);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading tags from " + tagsFile, e);
        } finally {
            lock.unlock();
        }
    }

    private void persistTags(Map<String, RfidTag> snapshot) {
        try {
            Files.createDirectories(tagsFile.toAbsolutePath().getParent());
            try (OutputStream out = Files.newOutputStream(tagsFile)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new ArrayList<>(snapshot.values()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing tags to " + tagsFile, e);
        }
    }

    private void appendLine(Path file, Object row) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(MAPPER.writeValueAsString(row));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending to " + file, e);
        }
    }
}
