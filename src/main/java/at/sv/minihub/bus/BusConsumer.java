package at.sv.minihub.bus;

import at.sv.minihub.model.Event;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Optional;

/**
 * Base for background workers reading the {@link EventBus} on their own thread. Subscribes on construction, so no
 * event published afterward is missed. A failure while handling one event is logged and the worker continues with
 * the next one.
 */
@Slf4j
public abstract class BusConsumer implements AutoCloseable {

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

    private final String name;
    private final Subscription subscription;
    private Thread worker;

    protected BusConsumer(String name, EventBus bus) {
        this.name = name;
        this.subscription = bus.subscribe();
    }

    protected abstract void onEvent(Event event);

    protected void onLag(long missed) {
        log.warn("Lagging behind the event bus, skipped {} events.", missed);
    }

    public synchronized void start() {
        if (worker != null) {
            throw new IllegalStateException(name + " already started");
        }
        worker = new Thread(this::runLoop, name);
        worker.setDaemon(true);
        worker.start();
    }

    private void runLoop() {
        MDC.put("context", name);
        log.debug("Started.");
        while (!subscription.isClosed()) {
            try {
                subscription.next(POLL_TIMEOUT).ifPresent(this::dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Stopped.");
        MDC.remove("context");
    }

    /**
     * Handles all messages that are currently available on the calling thread, without waiting for new ones.
     *
     * @return the number of handled messages
     */
    public int drain() {
        int handled = 0;
        Optional<BusMessage> message;
        while ((message = subscription.tryNext()).isPresent()) {
            dispatch(message.get());
            handled++;
        }
        return handled;
    }

    private void dispatch(BusMessage message) {
        if (message instanceof BusMessage.Lagged lagged) {
            onLag(lagged.missed());
        } else if (message instanceof BusMessage.Delivered delivered) {
            try {
                onEvent(delivered.event());
            } catch (Exception e) {
                log.error("Failed to handle {}: {}", delivered.event(), e.getLocalizedMessage(), e);
            }
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        subscription.close();
        Thread thread;
        synchronized (this) {
            thread = worker;
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(POLL_TIMEOUT.toMillis() * 2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
