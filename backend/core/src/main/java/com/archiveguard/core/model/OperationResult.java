package com.archiveguard.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Tagged outcome of a controller or scheduler operation. Optional parts are omitted from JSON
 * when absent.
 */
public record OperationResult(
        boolean success,
        String message,
        String status,
        CollectionConfig config,
        Instant timestamp,
        Map<String, Object> details
) {
    public static OperationResult success(String message) {
        return new OperationResult(true, message, null, null, null, null);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message, null, null, null, null);
    }

    public OperationResult withStatus(String newStatus) {
        return new OperationResult(success, message, newStatus, config, timestamp, details);
    }

    public OperationResult withConfig(CollectionConfig newConfig) {
        return new OperationResult(success, message, status, newConfig, timestamp, details);
    }

    public OperationResult withTimestamp(Instant newTimestamp) {
        return new OperationResult(success, message, status, config, newTimestamp, details);
    }

    public OperationResult withDetails(Map<String, Object> newDetails) {
        return new OperationResult(success, message, status, config, timestamp, newDetails);
    }
}
