package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@Jacksonized
public final class Automation {
    UUID id;
    String name;
    @Builder.Default
    boolean enabled = true;
    Trigger trigger;
    @Builder.Default
    List<Condition> conditions = List.of();
    @Builder.Default
    List<Action> actions = List.of();
    @JsonProperty("last_triggered")
    ZonedDateTime lastTriggered;

    /**
     * @throws ValidationException if the name, trigger or actions are missing, or any part is malformed
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Automation name cannot be empty");
        }
        if (trigger == null) {
            throw new ValidationException("Automation '" + name + "' has no trigger");
        }
        if (actions == null || actions.isEmpty()) {
            throw new ValidationException("Automation '" + name + "' needs at least one action");
        }
        if (conditions == null) {
            throw new ValidationException("Automation '" + name + "' has no condition list");
        }
        trigger.validate();
        conditions.forEach(Condition::validate);
        actions.forEach(Action::validate);
    }

    public String getContextName() {
        return "automation " + name;
    }
}
