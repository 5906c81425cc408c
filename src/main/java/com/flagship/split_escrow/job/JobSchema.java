package com.flagship.split_escrow.job;

import com.flagship.split_escrow.exception.SchemaValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of a job payload: required and optional fields with their JSON types.
 * Unknown fields are allowed.
 */
public final class JobSchema {

    private final Map<String, FieldType> required;
    private final Map<String, FieldType> optional;

    private JobSchema(Map<String, FieldType> required, Map<String, FieldType> optional) {
        this.required = Collections.unmodifiableMap(new LinkedHashMap<>(required));
        this.optional = Collections.unmodifiableMap(new LinkedHashMap<>(optional));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, FieldType> required() {
        return required;
    }

    public Map<String, FieldType> optional() {
        return optional;
    }

    /**
     * Collects every violation in the payload and throws once if there are any.
     * A required field present as JSON null counts as missing.
     */
    public void validate(String jobType, Map<String, Object> payload) {
        Map<String, Object> values = payload != null ? payload : Map.of();
        List<String> violations = new ArrayList<>();
        List<String> fields = new ArrayList<>();

        required.forEach((field, type) -> {
            Object value = values.get(field);
            if (value == null) {
                violations.add("Missing required field: " + field);
                fields.add(field);
            } else if (!type.accepts(value)) {
                violations.add(typeMismatch(field, type, value));
                fields.add(field);
            }
        });

        optional.forEach((field, type) -> {
            Object value = values.get(field);
            if (value != null && !type.accepts(value)) {
                violations.add(typeMismatch(field, type, value));
                fields.add(field);
            }
        });

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(jobType, violations, fields);
        }
    }

    private static String typeMismatch(String field, FieldType expected, Object value) {
        return String.format("Invalid type for field %s: expected %s, got %s",
                field, expected.jsonName(), FieldType.of(value).jsonName());
    }

    public static final class Builder {
        private final Map<String, FieldType> required = new LinkedHashMap<>();
        private final Map<String, FieldType> optional = new LinkedHashMap<>();

        public Builder required(String field, FieldType type) {
            required.put(field, type);
            return this;
        }

        public Builder optional(String field, FieldType type) {
            optional.put(field, type);
            return this;
        }

        public JobSchema build() {
            return new JobSchema(required, optional);
        }
    }
}
