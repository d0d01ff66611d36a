package at.sv.minihub.automation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One step of an automation. Actions run strictly one after the other.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CallServiceAction.class, name = "call_service"),
        @JsonSubTypes.Type(value = DelayAction.class, name = "delay")
})
public sealed interface Action permits CallServiceAction, DelayAction {

    void validate();
}
