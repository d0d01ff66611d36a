package at.sv.minihub.model;

import at.sv.minihub.error.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A single observable or controllable point, e.g. a light. Owned by exactly one {@link Device}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public final class Entity {

    private static final Pattern ENTITY_ID_PATTERN = Pattern.compile("[a-z0-9_]+\\.[a-z0-9_]+");

    UUID id;
    UUID deviceId;
    String entityId;
    String friendlyName;
    EntityState state;
    @Builder.Default
    Map<String, AttributeValue> attributes = new HashMap<>();
    ZonedDateTime lastChanged;
    ZonedDateTime lastUpdated;

    /**
     * @return the part in front of the dot, e.g. "light" for "light.kitchen"
     */
    public String getDomain() {
        int dot = entityId.indexOf('.');
        return dot < 0 ? entityId : entityId.substring(0, dot);
    }

    /**
     * Applies the given state. {@code lastChanged} only moves if the state value differs, {@code lastUpdated} always
     * moves.
     *
     * @return true, iff the state value changed
     */
    public boolean updateState(EntityState newState, ZonedDateTime timestamp) {
        boolean changed = state != newState;
        if (changed) {
            state = newState;
            lastChanged = timestamp;
        }
        lastUpdated = timestamp;
        return changed;
    }

    /**
     * Inserts or overwrites the given attributes. Keys missing in the patch are kept.
     *
     * @return the entries of the patch that actually changed a value, in patch order. Not null.
     */
    public Map<String, AttributeValue> mergeAttributes(Map<String, AttributeValue> patch, ZonedDateTime timestamp) {
        Map<String, AttributeValue> changed = new LinkedHashMap<>();
        patch.forEach((key, value) -> {
            if (!Objects.equals(attributes.get(key), value)) {
                changed.put(key, value);
            }
        });
        attributes.putAll(changed);
        lastUpdated = timestamp;
        return changed;
    }

    public AttributeValue getAttribute(String key) {
        return attributes.get(key);
    }

    public Entity copy() {
        return toBuilder().attributes(new HashMap<>(attributes)).build();
    }

    /**
     * @throws ValidationException if the entity id or friendly name is missing or malformed, or an attribute has no
     *                             value
     */
    public void validate() {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("entity_id cannot be empty");
        }
        if (!ENTITY_ID_PATTERN.matcher(entityId).matches()) {
            throw new ValidationException("Invalid entity_id '" + entityId + "'. Expected '<domain>.<object_id>', " +
                                          "using lower case letters, digits and underscores only.");
        }
        if (friendlyName == null || friendlyName.isBlank()) {
            throw new ValidationException("friendly_name cannot be empty");
        }
        if (attributes != null && attributes.values().stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("attribute values of '" + entityId + "' cannot be empty");
        }
    }
}
