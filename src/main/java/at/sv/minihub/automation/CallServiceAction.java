package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Calls a service like "turn_on" on an entity, either handled by the owning integration or locally.
 */
public record CallServiceAction(@JsonProperty("entity_id") String entityId, String service, Map<String, Object> data)
        implements Action {

    public CallServiceAction {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public CallServiceAction(String entityId, String service) {
        this(entityId, service, Map.of());
    }

    @Override
    public void validate() {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("call_service action requires an entity_id");
        }
        if (service == null || service.isBlank()) {
            throw new ValidationException("call_service action requires a service");
        }
    }
}
