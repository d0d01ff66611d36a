package at.sv.minihub.bus;

import at.sv.minihub.model.Event;

import java.time.Duration;
import java.util.Optional;

/**
 * A single reader's cursor into the {@link EventBus}. Not thread-safe: each subscription is meant to be read by one
 * consumer thread only, while {@link #close()} may be called from any thread.
 */
public final class Subscription implements AutoCloseable {

    private final EventBus bus;
    private long cursor;
    private volatile boolean closed;

    Subscription(EventBus bus, long cursor) {
        this.bus = bus;
        this.cursor = cursor;
    }

    /**
     * Returns the next message without waiting.
     *
     * @return the next message, or empty if no new event is available or the subscription is closed
     */
    public Optional<BusMessage> tryNext() {
        if (closed) {
            return Optional.empty();
        }
        while (true) {
            long tail = bus.getTail();
            long oldestRetained = tail - bus.getCapacity();
            if (cursor < oldestRetained) {
                long missed = oldestRetained - cursor;
                cursor = oldestRetained;
                return Optional.of(new BusMessage.Lagged(missed));
            }
            if (cursor >= tail) {
                return Optional.empty();
            }
            Event event = bus.read(cursor);
            if (event != null) {
                cursor++;
                return Optional.of(new BusMessage.Delivered(event));
            }
            // overwritten between reading the tail and the slot, recalculate the lag
        }
    }

    /**
     * Returns the next message, waiting up to the given timeout for a new event to be published.
     *
     * @return the next message, or empty if the timeout elapsed or the subscription is closed
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public Optional<BusMessage> next(Duration timeout) throws InterruptedException {
        Optional<BusMessage> message = tryNext();
        if (message.isPresent() || closed) {
            return message;
        }
        bus.awaitSequence(cursor, this, timeout);
        return tryNext();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        bus.wakeUpAll();
    }
}
