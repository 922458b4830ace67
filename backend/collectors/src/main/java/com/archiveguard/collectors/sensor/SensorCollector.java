package com.archiveguard.collectors.sensor;

import com.archiveguard.collectors.api.Collector;
import com.archiveguard.collectors.api.CollectorContext;
import com.archiveguard.collectors.api.CollectorResult;
import com.archiveguard.collectors.api.JobType;
import com.archiveguard.collectors.device.SensorSample;
import com.archiveguard.core.events.SensorBatchCollected;
import com.archiveguard.core.model.SensorReading;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class SensorCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(SensorCollector.class.getName());

    @Override
    public JobType jobType() {
        return JobType.SENSOR;
    }

    @Override
    public CollectorResult collect(CollectorContext ctx) {
        List<SensorSample> samples = ctx.deviceSampler().sampleSensors();
        Instant collectedAt = ctx.clock().instant();
        for (SensorSample sample : samples) {
            SensorReading reading = toReading(sample, collectedAt);
            ctx.readingStore().putReading(reading);
            LOGGER.fine(() -> "Sensor reading stored: " + reading.sensorId());
        }
        ctx.eventBus().publish(new SensorBatchCollected(collectedAt, samples.size()));

        Map<String, Object> stats = new HashMap<>();
        stats.put("readings", samples.size());
        return CollectorResult.success("Sensor collection completed", stats);
    }

    static SensorReading toReading(SensorSample sample, Instant collectedAt) {
        if (sample.sourceId() == null || sample.sourceId().isBlank()) {
            throw new IllegalArgumentException("Sensor sample is missing its source id");
        }
        String sourceId = sample.sourceId().trim();
        return new SensorReading(
                sourceId,
                MetricRange.TEMPERATURE.normalize(sourceId, sample.temperature()),
                MetricRange.HUMIDITY.normalize(sourceId, sample.humidity()),
                MetricRange.LIGHT_INTENSITY.normalize(sourceId, sample.lightIntensity()),
                sample.location(),
                collectedAt
        );
    }
}
