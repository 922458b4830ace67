package com.archiveguard.service.store;

import com.archiveguard.core.model.AuditEntry;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of configuration versions, scheduler status observations and the audit trail.
 * All three are append-only; implementations signal I/O failures with {@link IllegalStateException}.
 */
public interface ConfigStore {
    /**
     * Appends a new configuration version and returns it with its assigned id.
     */
    CollectionConfig insertConfig(CollectionConfig config);

    /**
     * The version with the latest {@code updatedAt}, ties broken by the highest id.
     */
    Optional<CollectionConfig> latestConfig();

    /**
     * Most recent versions first.
     */
    List<CollectionConfig> recentConfigs(int limit);

    Optional<CollectionConfig> findConfig(long id);

    CollectionStatus insertStatus(CollectionStatus status);

    Optional<CollectionStatus> latestStatus();

    /**
     * Observations at or after {@code since}, newest first.
     */
    List<CollectionStatus> statusSince(Instant since, int limit);

    /**
     * Removes observations older than {@code cutoff} and returns how many were dropped.
     */
    int pruneStatusBefore(Instant cutoff);

    void appendAudit(AuditEntry entry);

    List<AuditEntry> recentAudit(int limit);
}
