package com.archiveguard.core.model;

import java.time.Instant;

public record SensorReading(
        String sensorId,
        double temperature,
        double humidity,
        double lightIntensity,
        String location,
        Instant timestamp
) {
}
