package at.sv.minihub.automation;

import at.sv.minihub.model.Event;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What starts an automation run. Exactly one per automation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StateChangedTrigger.class, name = "state_changed"),
        @JsonSubTypes.Type(value = TimePatternTrigger.class, name = "time_pattern"),
        @JsonSubTypes.Type(value = ManualTrigger.class, name = "manual")
})
public sealed interface Trigger permits StateChangedTrigger, TimePatternTrigger, ManualTrigger {

    /**
     * @return true, if the given bus event starts a run. Only state changed triggers react to bus events.
     */
    default boolean matches(Event event) {
        return false;
    }

    /**
     * @throws at.sv.minihub.error.ValidationException if the trigger is malformed
     */
    void validate();
}
