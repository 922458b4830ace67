package com.archiveguard.service.config;

import com.archiveguard.service.runtime.SchedulerSettings;

import java.time.Duration;

/**
 * Settings from {@code service.json}. Absent numeric fields fall back to the built-in defaults.
 */
public record ServiceConfig(
        Integer port,
        String dataDir,
        Integer statusSampleSeconds,
        Integer stopTimeoutSeconds,
        Integer statusRetentionDays,
        Integer errorHistoryLimit
) {
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_DATA_DIR = "data";

    public ServiceConfig {
        port = port == null ? DEFAULT_PORT : port;
        dataDir = dataDir == null || dataDir.isBlank() ? DEFAULT_DATA_DIR : dataDir;
        statusSampleSeconds = statusSampleSeconds == null ? 30 : statusSampleSeconds;
        stopTimeoutSeconds = stopTimeoutSeconds == null ? 5 : stopTimeoutSeconds;
        statusRetentionDays = statusRetentionDays == null ? 30 : statusRetentionDays;
        errorHistoryLimit = errorHistoryLimit == null ? 50 : errorHistoryLimit;
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 0-65535");
        }
        if (statusRetentionDays < 1) {
            throw new IllegalArgumentException("statusRetentionDays must be at least 1");
        }
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig(null, null, null, null, null, null);
    }

    public ServiceConfig withPort(int newPort) {
        return new ServiceConfig(newPort, dataDir, statusSampleSeconds, stopTimeoutSeconds, statusRetentionDays,
                errorHistoryLimit);
    }

    public SchedulerSettings schedulerSettings() {
        return new SchedulerSettings(
                Duration.ofSeconds(statusSampleSeconds),
                Duration.ofSeconds(stopTimeoutSeconds),
                Duration.ofDays(statusRetentionDays),
                errorHistoryLimit
        );
    }
}
