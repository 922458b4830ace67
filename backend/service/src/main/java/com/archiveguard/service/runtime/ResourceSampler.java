package com.archiveguard.service.runtime;

import com.archiveguard.core.model.ResourceUsage;

@FunctionalInterface
public interface ResourceSampler {
    ResourceUsage sample();
}
