package com.archiveguard.collectors.support;

import com.archiveguard.core.bus.EventBus;
import com.archiveguard.core.events.Event;
import com.archiveguard.core.events.RfidTagSighted;
import com.archiveguard.core.events.SensorBatchCollected;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class EventCapture {
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public EventCapture(EventBus bus) {
        bus.subscribe(SensorBatchCollected.class, events::add);
        bus.subscribe(RfidTagSighted.class, events::add);
    }

    public <T extends Event> List<T> byType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<Event> all() {
        return List.copyOf(events);
    }
}
