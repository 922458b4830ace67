package com.archiveguard.collectors.api;

import com.archiveguard.collectors.device.DeviceSampler;
import com.archiveguard.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record CollectorContext(
        EventBus eventBus,
        ReadingStore readingStore,
        DeviceSampler deviceSampler,
        Clock clock
) {
    public CollectorContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(readingStore, "readingStore is required");
        Objects.requireNonNull(deviceSampler, "deviceSampler is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
