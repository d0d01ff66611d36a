package at.sv.minihub.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of something that happened in the hub. Use {@link EventFactory} to create events with strictly
 * increasing timestamps.
 */
@Value
@Builder
public class Event {
    UUID id;
    @JsonProperty("event_type")
    EventType type;
    /**
     * The entity id (e.g. "light.kitchen") this event refers to, or null.
     */
    @JsonProperty("entity_id")
    String entityId;
    ZonedDateTime timestamp;
    Map<String, Object> data;

    public boolean isOfType(EventType type) {
        return this.type == type;
    }

    public Object get(String key) {
        return data.get(key);
    }

    @Override
    public String toString() {
        return type + (entityId != null ? " " + entityId : "") + " " + data;
    }
}
