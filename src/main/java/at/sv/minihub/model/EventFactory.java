package at.sv.minihub.model;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates events with unique ids and strictly increasing timestamps, even if the clock stands still or goes back.
 */
public final class EventFactory {

    private final Supplier<ZonedDateTime> currentTime;
    private ZonedDateTime lastTimestamp;

    public EventFactory(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
    }

    public Event create(EventType type, String entityId, Map<String, ?> data) {
        return Event.builder()
                    .id(UUID.randomUUID())
                    .type(type)
                    .entityId(entityId)
                    .timestamp(nextTimestamp())
                    .data(Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                    .build();
    }

    public Event create(EventType type, Map<String, ?> data) {
        return create(type, null, data);
    }

    private synchronized ZonedDateTime nextTimestamp() {
        ZonedDateTime now = currentTime.get();
        if (lastTimestamp != null && !now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusNanos(1);
        }
        lastTimestamp = now;
        return now;
    }
}
