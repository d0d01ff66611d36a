package at.sv.minihub.model;

import at.sv.minihub.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityState {
    ON,
    OFF,
    UNKNOWN,
    UNAVAILABLE;

    @JsonCreator
    public static EntityState parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown entity state '" + value + "'. Supported values: on, off, unknown, unavailable");
        }
    }

    public boolean isAvailable() {
        return this != UNAVAILABLE;
    }

    public EntityState toggled() {
        return this == ON ? OFF : ON;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
