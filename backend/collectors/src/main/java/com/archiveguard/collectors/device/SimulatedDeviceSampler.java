package com.archiveguard.collectors.device;

import com.archiveguard.collectors.config.DeviceConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Generates plausible archive-room readings around each sensor's base values and occasionally
 * detects one of the active tags at a random online reader.
 */
public class SimulatedDeviceSampler implements DeviceSampler {
    private final DeviceConfig config;
    private final Supplier<List<String>> activeTagIds;
    private final Random random;

    public SimulatedDeviceSampler(DeviceConfig config, Supplier<List<String>> activeTagIds) {
        this(config, activeTagIds, new Random());
    }

    public SimulatedDeviceSampler(DeviceConfig config, Supplier<List<String>> activeTagIds, Random random) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.activeTagIds = Objects.requireNonNull(activeTagIds, "activeTagIds is required");
        this.random = Objects.requireNonNull(random, "random is required");
    }

    @Override
    public List<SensorSample> sampleSensors() {
        List<SensorSample> samples = new ArrayList<>();
        for (DeviceConfig.SensorSource source : config.sensors()) {
            samples.add(new SensorSample(
                    source.id(),
                    clamp(source.baseTemperature() + jitter(2.0), 15.0, 30.0),
                    clamp(source.baseHumidity() + jitter(5.0), 30.0, 70.0),
                    clamp(source.baseLight() + jitter(50.0), 50.0, 600.0),
                    source.location()
            ));
        }
        return samples;
    }

    @Override
    public Optional<TagDetection> scanRfid() {
        if (random.nextDouble() >= config.detectionProbability()) {
            return Optional.empty();
        }
        List<String> tags = activeTagIds.get();
        List<DeviceConfig.RfidReader> readers = config.readers().stream()
                .filter(DeviceConfig.RfidReader::isOnline)
                .toList();
        if (tags.isEmpty() || readers.isEmpty()) {
            return Optional.empty();
        }
        String tagId = tags.get(random.nextInt(tags.size()));
        DeviceConfig.RfidReader reader = readers.get(random.nextInt(readers.size()));
        return Optional.of(new TagDetection(tagId, reader.id(), reader.location()));
    }

    private double jitter(double amplitude) {
        return (random.nextDouble() * 2 - 1) * amplitude;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
