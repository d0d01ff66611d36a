package at.sv.minihub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    STATE_CHANGED,
    ATTRIBUTE_CHANGED,
    ENTITY_ADDED,
    ENTITY_REMOVED,
    AUTOMATION_TRIGGERED,
    SERVICE_CALLED,
    DEVICE_DETECTED,
    CUSTOM;

    public boolean affectsEntityState() {
        return this == STATE_CHANGED || this == ATTRIBUTE_CHANGED;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
