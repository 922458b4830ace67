package com.archiveguard.service.store;

import com.archiveguard.core.model.AuditEntry;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionStatus;
import com.archiveguard.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-backed {@link ConfigStore}: one JSON object per line per table, mirrored in memory.
 * A row becomes visible only after its line has been written.
 */
public class JsonlConfigStore implements ConfigStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Comparator<CollectionConfig> NEWEST_CONFIG_FIRST = Comparator
            .comparing(CollectionConfig::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CollectionConfig::id)
            .reversed();
    private static final Comparator<CollectionStatus> NEWEST_STATUS_FIRST = Comparator
            .comparing(CollectionStatus::timestamp)
            .thenComparing(CollectionStatus::id)
            .reversed();

    private final Path configFile;
    private final Path statusFile;
    private final Path auditFile;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CollectionConfig> configs = new ArrayList<>();
    private final List<CollectionStatus> statuses = new ArrayList<>();
    private final List<AuditEntry> audit = new ArrayList<>();
    private long nextConfigId = 1;
    private long nextStatusId = 1;

    public JsonlConfigStore(Path dataDir) {
        this.configFile = dataDir.resolve("collection_configs.jsonl");
        this.statusFile = dataDir.resolve("collection_status.jsonl");
        this.auditFile = dataDir.resolve("audit.jsonl");
        loadIfPresent();
    }

    @Override
    public CollectionConfig insertConfig(CollectionConfig config) {
        lock.lock();
        try {
            CollectionConfig stored = config.withId(nextConfigId);
            appendLine(configFile, stored);
            configs.add(stored);
            nextConfigId++;
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CollectionConfig> latestConfig() {
        lock.lock();
        try {
            return configs.stream().min(NEWEST_CONFIG_FIRST);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CollectionConfig> recentConfigs(int limit) {
        lock.lock();
        try {
            return configs.stream().sorted(NEWEST_CONFIG_FIRST).limit(Math.max(0, limit)).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CollectionConfig> findConfig(long id) {
        lock.lock();
        try {
            return configs.stream().filter(config -> config.id() == id).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CollectionStatus insertStatus(CollectionStatus status) {
        lock.lock();
        try {
            CollectionStatus stored = status.withId(nextStatusId);
            appendLine(statusFile, stored);
            statuses.add(stored);
            nextStatusId++;
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CollectionStatus> latestStatus() {
        lock.lock();
        try {
            return statuses.stream().min(NEWEST_STATUS_FIRST);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CollectionStatus> statusSince(Instant since, int limit) {
        lock.lock();
        try {
            return statuses.stream()
                    .filter(status -> !status.timestamp().isBefore(since))
                    .sorted(NEWEST_STATUS_FIRST)
                    .limit(Math.max(0, limit))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pruneStatusBefore(Instant cutoff) {
        lock.lock();
        try {
            List<CollectionStatus> kept = statuses.stream()
                    .filter(status -> !status.timestamp().isBefore(cutoff))
                    .toList();
            int dropped = statuses.size() - kept.size();
            if (dropped == 0) {
                return 0;
            }
            rewrite(statusFile, kept);
            statuses.clear();
            statuses.addAll(kept);
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendAudit(AuditEntry entry) {
        lock.lock();
        try {
            appendLine(auditFile, entry);
            audit.add(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AuditEntry> recentAudit(int limit) {
        lock.lock();
        try {
            int from = Math.max(0, audit.size() - Math.max(0, limit));
            List<AuditEntry> tail = new ArrayList<>(audit.subList(from, audit.size()));
            Collections.reverse(tail);
            return tail;
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            configs.addAll(readAll(configFile, CollectionConfig.class));
            statuses.addAll(readAll(statusFile, CollectionStatus.class));
            audit.addAll(readAll(auditFile, AuditEntry.class));
            nextConfigId = configs.stream().mapToLong(CollectionConfig::id).max().orElse(0) + 1;
            nextStatusId = statuses.stream().mapToLong(CollectionStatus::id).max().orElse(0) + 1;
        } finally {
            lock.unlock();
        }
    }

    private <T> List<T> readAll(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<T> rows = new ArrayList<>();
        int lineNumber = 0;
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                rows.add(MAPPER.readValue(line, type));
            }
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed loading " + file + " at line " + lineNumber, e);
        }
        return rows;
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

    private void rewrite(Path file, List<?> rows) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (Object row : rows) {
                    writer.write(MAPPER.writeValueAsString(row));
                    writer.newLine();
                }
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed rewriting " + file, e);
        }
    }
}
