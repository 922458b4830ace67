package com.archiveguard.collectors.sensor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Physical domain and stored precision of each environmental metric.
 */
public enum MetricRange {
    TEMPERATURE("temperature", -50.0, 100.0, 1),
    HUMIDITY("humidity", 0.0, 100.0, 1),
    LIGHT_INTENSITY("lightIntensity", 0.0, 100_000.0, 0);

    private final String metric;
    private final double min;
    private final double max;
    private final int scale;

    MetricRange(String metric, double min, double max, int scale) {
        this.metric = metric;
        this.min = min;
        this.max = max;
        this.scale = scale;
    }

    public double normalize(String sourceId, double raw) {
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            throw new IllegalArgumentException("Sensor " + sourceId + " reported non-numeric " + metric);
        }
        double clamped = Math.max(min, Math.min(max, raw));
        return BigDecimal.valueOf(clamped).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }
}
