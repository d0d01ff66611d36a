package at.sv.minihub.storage.memory;

import at.sv.minihub.model.Event;
import at.sv.minihub.storage.EventStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class InMemoryEventStore implements EventStore {

    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized void append(Event event) {
        events.add(event);
    }

    @Override
    public synchronized List<Event> findRecent(int limit) {
        List<Event> recent = new ArrayList<>(events.subList(Math.max(0, events.size() - limit), events.size()));
        Collections.reverse(recent);
        return recent;
    }

    @Override
    public synchronized List<Event> findByEntityId(String entityId) {
        return events.stream()
                     .filter(event -> entityId.equals(event.getEntityId()))
                     .toList();
    }
}
