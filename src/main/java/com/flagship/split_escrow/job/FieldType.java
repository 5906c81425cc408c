package com.flagship.split_escrow.job;

import java.util.Collection;

/**
 * JSON value kinds a job schema can require.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String jsonName;

    FieldType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public boolean accepts(Object value) {
        return this == of(value);
    }

    /**
     * Kind of a decoded JSON value, or null for JSON null.
     */
    public static FieldType of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence || value instanceof java.util.UUID) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Collection || value.getClass().isArray()) {
            return ARRAY;
        }
        // Map or any other decoded structure
        return OBJECT;
    }
}
