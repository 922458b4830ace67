package com.archiveguard.collectors.device;

import java.util.List;
import java.util.Optional;

/**
 * Source of raw device data. Implementations may talk to hardware, replay fixtures or simulate.
 */
public interface DeviceSampler {
    /**
     * Returns one raw sample per known sensor source.
     */
    List<SensorSample> sampleSensors();

    /**
     * Returns at most one tag detection for this scan.
     */
    Optional<TagDetection> scanRfid();
}
