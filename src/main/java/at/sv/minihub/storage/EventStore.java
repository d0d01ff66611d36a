package at.sv.minihub.storage;

import at.sv.minihub.model.Event;

import java.util.List;

/**
 * Append-only log of all published events.
 */
public interface EventStore {

    void append(Event event);

    /**
     * @return the latest events, newest first
     */
    List<Event> findRecent(int limit);

    /**
     * @return all stored events for the given entity id, oldest first
     */
    List<Event> findByEntityId(String entityId);
}
