package com.archiveguard.service.support;

import com.archiveguard.core.model.AuditEntry;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionStatus;
import com.archiveguard.service.store.ConfigStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Config store kept in memory. Reads and writes can be switched to fail like an unreachable disk.
 */
public class InMemoryConfigStore implements ConfigStore {
    private static final Comparator<CollectionConfig> NEWEST_CONFIG_FIRST = Comparator
            .comparing(CollectionConfig::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CollectionConfig::id)
            .reversed();
    private static final Comparator<CollectionStatus> NEWEST_STATUS_FIRST = Comparator
            .comparing(CollectionStatus::timestamp)
            .thenComparing(CollectionStatus::id)
            .reversed();

    private final List<CollectionConfig> configs = new ArrayList<>();
    private final List<CollectionStatus> statuses = new ArrayList<>();
    private final List<AuditEntry> audit = new ArrayList<>();
    private final AtomicBoolean failReads = new AtomicBoolean();
    private final AtomicBoolean failWrites = new AtomicBoolean();
    private long nextConfigId = 1;
    private long nextStatusId = 1;

    public void failReads(boolean fail) {
        failReads.set(fail);
    }

    public void failWrites(boolean fail) {
        failWrites.set(fail);
    }

    @Override
    public synchronized CollectionConfig insertConfig(CollectionConfig config) {
        checkWrite();
        CollectionConfig stored = config.withId(nextConfigId++);
        configs.add(stored);
        return stored;
    }

    @Override
    public synchronized Optional<CollectionConfig> latestConfig() {
        checkRead();
        return configs.stream().min(NEWEST_CONFIG_FIRST);
    }

    @Override
    public synchronized List<CollectionConfig> recentConfigs(int limit) {
        checkRead();
        return configs.stream().sorted(NEWEST_CONFIG_FIRST).limit(limit).toList();
    }

    @Override
    public synchronized Optional<CollectionConfig> findConfig(long id) {
        checkRead();
        return configs.stream().filter(config -> config.id() == id).findFirst();
    }

    @Override
    public synchronized CollectionStatus insertStatus(CollectionStatus status) {
        checkWrite();
        CollectionStatus stored = status.withId(nextStatusId++);
        statuses.add(stored);
        return stored;
    }

    @Override
    public synchronized Optional<CollectionStatus> latestStatus() {
        checkRead();
        return statuses.stream().min(NEWEST_STATUS_FIRST);
    }

    @Override
    public synchronized List<CollectionStatus> statusSince(Instant since, int limit) {
        checkRead();
        return statuses.stream()
                .filter(status -> !status.timestamp().isBefore(since))
                .sorted(NEWEST_STATUS_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized int pruneStatusBefore(Instant cutoff) {
        checkWrite();
        int before = statuses.size();
        statuses.removeIf(status -> status.timestamp().isBefore(cutoff));
        return before - statuses.size();
    }

    @Override
    public synchronized void appendAudit(AuditEntry entry) {
        checkWrite();
        audit.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> recentAudit(int limit) {
        checkRead();
        List<AuditEntry> tail = new ArrayList<>(audit.subList(Math.max(0, audit.size() - limit), audit.size()));
        Collections.reverse(tail);
        return tail;
    }

    public synchronized int configCount() {
        return configs.size();
    }

    public synchronized List<CollectionConfig> allConfigs() {
        return List.copyOf(configs);
    }

    public synchronized List<CollectionStatus> allStatuses() {
        return List.copyOf(statuses);
    }

    public synchronized List<AuditEntry> allAudit() {
        return List.copyOf(audit);
    }

    private void checkRead() {
        if (failReads.get()) {
            throw new IllegalStateException("config store unavailable");
        }
    }

    private void checkWrite() {
        if (failWrites.get()) {
            throw new IllegalStateException("config store unavailable");
        }
    }
}
