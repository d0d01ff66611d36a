package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.EntityState;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StateIsCondition(@JsonProperty("entity_id") String entityId, EntityState state) implements Condition {

    @Override
    public boolean isSatisfied(ConditionContext context) {
        return context.getState(entityId)
                      .map(current -> current == state)
                      .orElse(false);
    }

    @Override
    public void validate() {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("state_is condition requires an entity_id");
        }
        if (state == null) {
            throw new ValidationException("state_is condition requires a state");
        }
    }
}
