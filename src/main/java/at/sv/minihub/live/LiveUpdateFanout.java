package at.sv.minihub.live;

import at.sv.minihub.bus.BusConsumer;
import at.sv.minihub.bus.EventBus;
import at.sv.minihub.error.InternalFailure;
import at.sv.minihub.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes every bus event as JSON to all streaming clients. A client whose queue is full is disconnected, so a slow
 * client never delays the bus or any other client.
 */
@Slf4j
public final class LiveUpdateFanout extends BusConsumer {

    private final ObjectMapper objectMapper;
    private final int queueCapacity;
    private final Map<UUID, LiveUpdateSubscription> subscriptions = new ConcurrentHashMap<>();

    public LiveUpdateFanout(EventBus bus, ObjectMapper objectMapper, int queueCapacity) {
        super("fan-out", bus);
        this.objectMapper = objectMapper;
        this.queueCapacity = queueCapacity;
    }

    public LiveUpdateSubscription subscribe() {
        LiveUpdateSubscription subscription = new LiveUpdateSubscription(queueCapacity,
                closed -> subscriptions.remove(closed.getId()));
        subscriptions.put(subscription.getId(), subscription);
        log.debug("Client {} subscribed, {} clients connected.", subscription.getId(), subscriptions.size());
        return subscription;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    @Override
    protected void onEvent(Event event) {
        if (subscriptions.isEmpty()) {
            return;
        }
        String json = serialize(event);
        subscriptions.values().forEach(subscription -> {
            if (!subscription.offer(json)) {
                subscriptions.remove(subscription.getId());
                subscription.drop();
                log.warn("Client {} cannot keep up, disconnected.", subscription.getId());
            }
        });
    }

    private String serialize(Event event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new InternalFailure("Failed to serialize " + event, e);
        }
    }
}
