package at.sv.minihub.live;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Outbound queue of one streaming client, holding serialized events. Once closed, either by the client or because
 * it could not keep up, no further events are queued.
 */
public final class LiveUpdateSubscription implements AutoCloseable {

    private final UUID id = UUID.randomUUID();
    private final BlockingQueue<String> queue;
    private final Consumer<LiveUpdateSubscription> onClose;
    private volatile boolean closed;
    private volatile boolean dropped;

    LiveUpdateSubscription(int capacity, Consumer<LiveUpdateSubscription> onClose) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    public UUID getId() {
        return id;
    }

    /**
     * @return false if the queue is full or the subscription closed
     */
    boolean offer(String json) {
        return !closed && queue.offer(json);
    }

    /**
     * Takes the next queued event, waiting up to the given timeout. Events queued before a disconnect can still be
     * taken.
     *
     * @return the JSON of the next event, or empty if none arrived in time or the subscription is closed and drained
     */
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        String next = queue.poll();
        if (next != null || closed) {
            return Optional.ofNullable(next);
        }
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return true, if the subscription was closed because it could not keep up
     */
    public boolean isDropped() {
        return dropped;
    }

    void drop() {
        dropped = true;
        closed = true;
    }

    @Override
    public void close() {
        closed = true;
        onClose.accept(this);
    }
}
