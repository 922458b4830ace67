package com.archiveguard.collectors.support;

import com.archiveguard.collectors.device.DeviceSampler;
import com.archiveguard.collectors.device.SensorSample;
import com.archiveguard.collectors.device.TagDetection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Replays queued samples; an empty queue yields no readings and no detection.
 */
public class ScriptedDeviceSampler implements DeviceSampler {
    private final Deque<List<SensorSample>> sensorBatches = new ArrayDeque<>();
    private final Deque<Optional<TagDetection>> detections = new ArrayDeque<>();
    private RuntimeException failure;

    public ScriptedDeviceSampler queueSensors(List<SensorSample> batch) {
        sensorBatches.addLast(batch);
        return this;
    }

    public ScriptedDeviceSampler queueDetection(TagDetection detection) {
        detections.addLast(Optional.ofNullable(detection));
        return this;
    }

    public ScriptedDeviceSampler failWith(RuntimeException error) {
        this.failure = error;
        return this;
    }

    @Override
    public synchronized List<SensorSample> sampleSensors() {
        if (failure != null) {
            throw failure;
        }
        List<SensorSample> next = sensorBatches.pollFirst();
        return next == null ? List.of() : next;
    }

    @Override
    public synchronized Optional<TagDetection> scanRfid() {
        if (failure != null) {
            throw failure;
        }
        Optional<TagDetection> next = detections.pollFirst();
        return next == null ? Optional.empty() : next;
    }
}
