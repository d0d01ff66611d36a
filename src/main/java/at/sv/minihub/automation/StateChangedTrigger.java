package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventData;
import at.sv.minihub.model.EventType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fires on state changes of one entity, optionally restricted to a specific old and/or new state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateChangedTrigger(@JsonProperty("entity_id") String entityId, EntityState from, EntityState to)
        implements Trigger {

    public static StateChangedTrigger forNewState(String entityId, EntityState to) {
        return new StateChangedTrigger(entityId, null, to);
    }

    @Override
    public boolean matches(Event event) {
        return event.isOfType(EventType.STATE_CHANGED)
               && entityId.equals(event.getEntityId())
               && (from == null || from == event.get(EventData.OLD_STATE))
               && (to == null || to == event.get(EventData.NEW_STATE));
    }

    @Override
    public void validate() {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("state_changed trigger requires an entity_id");
        }
    }
}
