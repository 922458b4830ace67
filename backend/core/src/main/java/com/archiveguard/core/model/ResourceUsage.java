package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Host resource snapshot. {@code cpuUsage} is null when the platform cannot report it.
 */
public record ResourceUsage(Double cpuUsage, double memoryUsage, @JsonProperty("memoryUsedMB") double memoryUsedMb) {
    public static final ResourceUsage UNAVAILABLE = new ResourceUsage(null, 0, 0);
}
