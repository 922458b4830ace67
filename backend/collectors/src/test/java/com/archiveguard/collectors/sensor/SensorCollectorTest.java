package com.archiveguard.collectors.sensor;

import com.archiveguard.collectors.api.CollectorContext;
import com.archiveguard.collectors.api.CollectorResult;
import com.archiveguard.collectors.device.SensorSample;
import com.archiveguard.collectors.support.EventCapture;
import com.archiveguard.collectors.support.InMemoryReadingStore;
import com.archiveguard.collectors.support.MutableClock;
import com.archiveguard.collectors.support.ScriptedDeviceSampler;
import com.archiveguard.core.bus.EventBus;
import com.archiveguard.core.events.SensorBatchCollected;
import com.archiveguard.core.model.SensorReading;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensorCollectorTest {
    private static final Instant NOW = Instant.parse("2026-04-02T09:30:00Z");

    @Test
    void storesOneReadingPerSourceAndPublishesBatch() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        InMemoryReadingStore store = new InMemoryReadingStore(List.of());
        ScriptedDeviceSampler sampler = new ScriptedDeviceSampler().queueSensors(List.of(
                new SensorSample("SENSOR_001", 21.04, 48.96, 300.4, "Archive Room A"),
                new SensorSample("SENSOR_002", 22.45, 51.25, 280.5, "Archive Room B")
        ));

        CollectorResult result = new SensorCollector().collect(context(bus, store, sampler));

        assertTrue(result.success());
        assertEquals(2, result.stats().get("readings"));
        List<SensorReading> readings = store.readings();
        assertEquals(2, readings.size());
        assertEquals(21.0, readings.get(0).temperature());
        assertEquals(49.0, readings.get(0).humidity());
        assertEquals(300.0, readings.get(0).lightIntensity());
        assertEquals(22.5, readings.get(1).temperature());
        assertEquals(51.3, readings.get(1).humidity());
        assertEquals(281.0, readings.get(1).lightIntensity());
        assertEquals(NOW, readings.get(1).timestamp());
        assertEquals(1, capture.byType(SensorBatchCollected.class).size());
        assertEquals(2, capture.byType(SensorBatchCollected.class).get(0).readingCount());
    }

    @Test
    void clampsOutOfRangeValuesToPhysicalLimits() {
        SensorReading reading = SensorCollector.toReading(
                new SensorSample("SENSOR_009", 140.0, -3.0, 250_000.0, "Vault"), NOW);

        assertEquals(100.0, reading.temperature());
        assertEquals(0.0, reading.humidity());
        assertEquals(100_000.0, reading.lightIntensity());

        SensorReading cold = SensorCollector.toReading(
                new SensorSample("SENSOR_009", -80.0, 120.0, -5.0, "Vault"), NOW);

        assertEquals(-50.0, cold.temperature());
        assertEquals(100.0, cold.humidity());
        assertEquals(0.0, cold.lightIntensity());
    }

    @Test
    void rejectsNonNumericValues() {
        assertThrows(IllegalArgumentException.class, () -> SensorCollector.toReading(
                new SensorSample("SENSOR_001", Double.NaN, 50.0, 300.0, "Archive Room A"), NOW));
    }

    @Test
    void rejectsSampleWithoutSourceId() {
        assertThrows(IllegalArgumentException.class, () -> SensorCollector.toReading(
                new SensorSample(" ", 20.0, 50.0, 300.0, "Archive Room A"), NOW));
    }

    @Test
    void samplerFailurePropagatesToCaller() {
        InMemoryReadingStore store = new InMemoryReadingStore(List.of());
        ScriptedDeviceSampler sampler = new ScriptedDeviceSampler().failWith(new IllegalStateException("bus offline"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new SensorCollector().collect(context(new EventBus(), store, sampler)));

        assertEquals("bus offline", error.getMessage());
        assertTrue(store.readings().isEmpty());
    }

    private static CollectorContext context(EventBus bus, InMemoryReadingStore store, ScriptedDeviceSampler sampler) {
        return new CollectorContext(bus, store, sampler, new MutableClock(NOW, ZoneOffset.UTC));
    }
}
