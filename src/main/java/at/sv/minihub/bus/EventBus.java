package at.sv.minihub.bus;

import at.sv.minihub.model.Event;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded broadcast ring buffer. Every subscriber has its own read cursor; publishing overwrites the oldest slot
 * once the buffer is full and never waits for subscribers. A subscriber that fell behind by more than the capacity
 * reads a {@link BusMessage.Lagged} message and continues with the oldest retained event.
 */
@Slf4j
public final class EventBus implements EventPublisher {

    private final int capacity;
    private final AtomicReferenceArray<Slot> slots;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();
    /**
     * Sequence number of the next event to publish. Equals the total number of published events.
     */
    private volatile long tail;

    public EventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event bus capacity must be > 0");
        }
        this.capacity = capacity;
        this.slots = new AtomicReferenceArray<>(capacity);
    }

    @Override
    public void publish(Event event) {
        lock.lock();
        try {
            long sequence = tail;
            slots.set(index(sequence), new Slot(sequence, event));
            tail = sequence + 1;
            published.signalAll();
        } finally {
            lock.unlock();
        }
        log.trace("Published {}", event);
    }

    /**
     * @return a new subscription that receives all events published from now on
     */
    public Subscription subscribe() {
        return new Subscription(this, tail);
    }

    public int getCapacity() {
        return capacity;
    }

    long getTail() {
        return tail;
    }

    /**
     * @return the event stored with the given sequence number, or null if it was already overwritten
     */
    Event read(long sequence) {
        Slot slot = slots.get(index(sequence));
        if (slot == null || slot.sequence != sequence) {
            return null;
        }
        return slot.event;
    }

    /**
     * Waits until an event with the given sequence number was published, the subscription was closed, or the timeout
     * elapsed.
     */
    void awaitSequence(long sequence, Subscription subscription, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (tail <= sequence && !subscription.isClosed() && remaining > 0) {
                remaining = published.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    void wakeUpAll() {
        lock.lock();
        try {
            published.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private int index(long sequence) {
        return (int) (sequence % capacity);
    }

    private record Slot(long sequence, Event event) {
    }
}
