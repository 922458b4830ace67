package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estimated load implied by a pair of polling intervals. Loads are ticks per minute.
 */
public record PerformanceImpact(
        double sensorLoad,
        double rfidLoad,
        double totalLoad,
        double estimatedCpuUsage,
        @JsonProperty("estimatedMemoryMB") double estimatedMemoryMb,
        PerformanceLevel performanceLevel,
        @JsonInclude(JsonInclude.Include.ALWAYS) String warning
) {
    static final double HIGH_LOAD_THRESHOLD = 20;
    static final double MEDIUM_LOAD_THRESHOLD = 10;

    public static PerformanceImpact of(int sensorInterval, int rfidInterval) {
        double sensorLoad = 60.0 / sensorInterval;
        double rfidLoad = 60.0 / rfidInterval;
        double totalLoad = sensorLoad + rfidLoad;
        double estimatedCpuUsage = Math.min(100, (sensorLoad * 0.5 + rfidLoad * 1.0) / 100);
        double estimatedMemoryMb = sensorLoad * 0.1 + rfidLoad * 0.2;

        PerformanceLevel level;
        String warning;
        if (totalLoad > HIGH_LOAD_THRESHOLD) {
            level = PerformanceLevel.HIGH;
            warning = "Collection frequency is high and may affect system performance";
        } else if (totalLoad > MEDIUM_LOAD_THRESHOLD) {
            level = PerformanceLevel.MEDIUM;
            warning = "Collection frequency is moderate; keep an eye on system performance";
        } else {
            level = PerformanceLevel.LOW;
            warning = null;
        }
        return new PerformanceImpact(sensorLoad, rfidLoad, totalLoad, estimatedCpuUsage, estimatedMemoryMb, level, warning);
    }
}
