package at.sv.minihub.automation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A gate evaluated after the trigger matched. All conditions of an automation have to be satisfied.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StateIsCondition.class, name = "state_is"),
        @JsonSubTypes.Type(value = TimeRangeCondition.class, name = "time_range")
})
public sealed interface Condition permits StateIsCondition, TimeRangeCondition {

    boolean isSatisfied(ConditionContext context);

    void validate();
}
