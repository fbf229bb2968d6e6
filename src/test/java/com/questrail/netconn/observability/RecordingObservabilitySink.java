package com.questrail.netconn.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ConnectionObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTraffic(ConnectionTrafficEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLifecycle(ConnectionLifecycleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ConnectionErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConnectionTrafficEvent> getTraffic(ConnectionTrafficEvent.Direction direction) {
        return events.stream()
            .filter(e -> e instanceof ConnectionTrafficEvent)
            .map(e -> (ConnectionTrafficEvent) e)
            .filter(e -> e.direction() == direction)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasLifecycle(ConnectionLifecycleEvent.Kind kind) {
        return events.stream()
            .anyMatch(e -> e instanceof ConnectionLifecycleEvent l && l.kind() == kind);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
