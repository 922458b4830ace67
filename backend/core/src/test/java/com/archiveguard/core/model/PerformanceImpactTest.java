package com.archiveguard.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class PerformanceImpactTest {
    private static final double EPSILON = 1e-9;

    @Test
    void defaultIntervalsAreLowImpact() {
        PerformanceImpact impact = PerformanceImpact.of(30, 10);

        assertEquals(2.0, impact.sensorLoad(), EPSILON);
        assertEquals(6.0, impact.rfidLoad(), EPSILON);
        assertEquals(8.0, impact.totalLoad(), EPSILON);
        assertEquals(0.07, impact.estimatedCpuUsage(), EPSILON);
        assertEquals(1.4, impact.estimatedMemoryMb(), EPSILON);
        assertEquals(PerformanceLevel.LOW, impact.performanceLevel());
        assertNull(impact.warning());
    }

    @Test
    void moderateLoadIsMediumWithWarning() {
        PerformanceImpact impact = PerformanceImpact.of(10, 10);

        assertEquals(12.0, impact.totalLoad(), EPSILON);
        assertEquals(PerformanceLevel.MEDIUM, impact.performanceLevel());
        assertNotNull(impact.warning());
    }

    @Test
    void fastIntervalsAreHighImpact() {
        PerformanceImpact impact = PerformanceImpact.of(5, 3);

        assertEquals(12.0, impact.sensorLoad(), EPSILON);
        assertEquals(20.0, impact.rfidLoad(), EPSILON);
        assertEquals(32.0, impact.totalLoad(), EPSILON);
        assertEquals(PerformanceLevel.HIGH, impact.performanceLevel());
        assertEquals("Collection frequency is high and may affect system performance", impact.warning());
    }

    @Test
    void exactlyTwentyIsStillMedium() {
        PerformanceImpact impact = PerformanceImpact.of(6, 6);

        assertEquals(20.0, impact.totalLoad(), EPSILON);
        assertEquals(PerformanceLevel.MEDIUM, impact.performanceLevel());
    }

    @Test
    void fastestSettingsKeepCpuEstimateWithinBounds() {
        PerformanceImpact impact = PerformanceImpact.of(1, 1);

        assertEquals(120.0, impact.totalLoad(), EPSILON);
        assertEquals(0.9, impact.estimatedCpuUsage(), EPSILON);
    }
}
