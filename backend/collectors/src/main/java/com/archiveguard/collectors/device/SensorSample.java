package com.archiveguard.collectors.device;

public record SensorSample(
        String sourceId,
        double temperature,
        double humidity,
        double lightIntensity,
        String location
) {
}
