package com.archiveguard.service.runtime;

import java.time.Duration;
import java.util.Objects;

public record SchedulerSettings(
        Duration statusSampleInterval,
        Duration stopTimeout,
        Duration statusRetention,
        int errorHistoryLimit
) {
    public static final int RECENT_ERROR_COUNT = 5;

    public SchedulerSettings {
        Objects.requireNonNull(statusSampleInterval, "statusSampleInterval is required");
        Objects.requireNonNull(stopTimeout, "stopTimeout is required");
        Objects.requireNonNull(statusRetention, "statusRetention is required");
        if (statusSampleInterval.isZero() || statusSampleInterval.isNegative()) {
            throw new IllegalArgumentException("statusSampleInterval must be positive");
        }
        if (stopTimeout.isNegative()) {
            throw new IllegalArgumentException("stopTimeout must not be negative");
        }
        if (errorHistoryLimit < 1) {
            throw new IllegalArgumentException("errorHistoryLimit must be at least 1");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofDays(30), 50);
    }
}
