package com.archiveguard.service.runtime;

import com.archiveguard.core.model.ResourceUsage;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host CPU and physical memory as reported by the platform MXBean. CPU is null until the
 * platform has a first load reading.
 */
public class JvmResourceSampler implements ResourceSampler {
    private static final Logger LOGGER = Logger.getLogger(JvmResourceSampler.class.getName());
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public ResourceUsage sample() {
        try {
            if (!(osBean instanceof com.sun.management.OperatingSystemMXBean os)) {
                return ResourceUsage.UNAVAILABLE;
            }
            double load = os.getCpuLoad();
            Double cpu = load < 0 ? null : round(Math.min(100.0, load * 100.0));
            long total = os.getTotalMemorySize();
            long used = total - os.getFreeMemorySize();
            double memoryPercent = total <= 0 ? 0 : round(used * 100.0 / total);
            return new ResourceUsage(cpu, memoryPercent, round(used / BYTES_PER_MB));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reading host resource usage failed", e);
            return ResourceUsage.UNAVAILABLE;
        }
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
