package com.archiveguard.core.model;

public record RecommendedConfig(int sensorInterval, int rfidInterval, String reason) {
    public static final RecommendedConfig BALANCED =
            new RecommendedConfig(30, 15, "Balanced between data freshness and system load");
}
