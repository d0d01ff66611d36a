package at.sv.minihub.bus;

import at.sv.minihub.model.Event;

/**
 * What a subscriber reads from the bus: either the next event, or the number of events it missed.
 */
public sealed interface BusMessage permits BusMessage.Delivered, BusMessage.Lagged {

    record Delivered(Event event) implements BusMessage {
    }

    record Lagged(long missed) implements BusMessage {
    }
}
