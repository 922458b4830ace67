package com.archiveguard.collectors.config;

import java.util.List;

public record DeviceConfig(
        List<SensorSource> sensors,
        List<RfidReader> readers,
        double detectionProbability
) {
    public static final double DEFAULT_DETECTION_PROBABILITY = 0.3;

    public DeviceConfig {
        sensors = sensors == null ? List.of() : List.copyOf(sensors);
        readers = readers == null ? List.of() : List.copyOf(readers);
        if (detectionProbability < 0 || detectionProbability > 1) {
            throw new IllegalArgumentException("detectionProbability must be within 0-1");
        }
    }

    public static DeviceConfig defaults() {
        return new DeviceConfig(
                List.of(
                        new SensorSource("SENSOR_001", "Archive Room A", 22.0, 50.0, 300.0),
                        new SensorSource("SENSOR_002", "Archive Room B", 21.5, 48.0, 280.0),
                        new SensorSource("SENSOR_003", "Archive Room C", 23.0, 52.0, 320.0)
                ),
                List.of(
                        new RfidReader("1", "RFID_READER_001", "Archive Entrance", "online"),
                        new RfidReader("2", "RFID_READER_002", "Archive Exit", "online")
                ),
                DEFAULT_DETECTION_PROBABILITY
        );
    }

    public record SensorSource(
            String id,
            String location,
            double baseTemperature,
            double baseHumidity,
            double baseLight
    ) {
    }

    public record RfidReader(String id, String name, String location, String status) {
        public boolean isOnline() {
            return "online".equalsIgnoreCase(status);
        }
    }
}
