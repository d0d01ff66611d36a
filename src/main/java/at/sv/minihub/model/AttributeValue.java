package at.sv.minihub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;

/**
 * A single entity attribute: a boolean, an integer, a floating point number, a string, or any other JSON value.
 */
@EqualsAndHashCode
public final class AttributeValue {

    private final Object value;

    private AttributeValue(Object value) {
        this.value = value;
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(value);
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(value);
    }

    public static AttributeValue of(String value) {
        return new AttributeValue(value);
    }

    public static AttributeValue of(JsonNode value) {
        return new AttributeValue(value.deepCopy());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AttributeValue fromJson(JsonNode node) {
        if (node.isBoolean()) {
            return of(node.booleanValue());
        } else if (node.isIntegralNumber()) {
            return of(node.longValue());
        } else if (node.isNumber()) {
            return of(node.doubleValue());
        } else if (node.isTextual()) {
            return of(node.textValue());
        }
        return of(node);
    }

    @JsonValue
    public Object getValue() {
        return value;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public boolean isNumber() {
        return value instanceof Long || value instanceof Double;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public Double asDouble() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
