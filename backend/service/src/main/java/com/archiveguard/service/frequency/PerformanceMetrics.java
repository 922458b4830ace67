package com.archiveguard.service.frequency;

import com.archiveguard.core.model.CollectionStatus;
import com.archiveguard.core.model.IntervalSummary;
import com.archiveguard.core.model.PerformanceImpact;
import com.archiveguard.core.model.RecommendedConfig;

import java.time.Instant;

public record PerformanceMetrics(
        IntervalSummary currentConfig,
        PerformanceImpact performanceImpact,
        RecommendedConfig recommendedConfig,
        CollectionStatus systemStatus,
        Instant timestamp,
        String error
) {
    static PerformanceMetrics failed(Instant timestamp, String error) {
        return new PerformanceMetrics(null, null, null, null, timestamp, error);
    }
}
