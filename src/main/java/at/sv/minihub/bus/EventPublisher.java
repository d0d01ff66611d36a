package at.sv.minihub.bus;

import at.sv.minihub.model.Event;

public interface EventPublisher {
    /**
     * Publishes the event to all current subscribers. Never blocks on slow subscribers.
     */
    void publish(Event event);
}
