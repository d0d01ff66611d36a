package at.sv.minihub.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of an entity's state and attributes at a point in time. Never updated, only purged.
 */
@Value
@Builder
public class EntityHistory {
    UUID id;
    String entityId;
    EntityState state;
    Map<String, AttributeValue> attributes;
    ZonedDateTime recordedAt;
}
