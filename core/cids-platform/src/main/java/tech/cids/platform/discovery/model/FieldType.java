package tech.cids.platform.discovery.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of a field in a capability description.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    DATE("date"),
    DATETIME("datetime");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public static FieldType fromValue(String value) {
        for (FieldType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + value);
    }
}
