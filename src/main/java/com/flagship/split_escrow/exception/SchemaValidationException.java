package com.flagship.split_escrow.exception;

import lombok.Getter;

import java.util.List;

/**
 * A job payload did not match the schema registered for its type.
 *
 * Carries every violation found, not just the first one, so callers can fix
 * the payload in a single round trip.
 */
@Getter
public class SchemaValidationException extends ValidationException {

    private final String jobType;
    private final List<String> violations;
    private final List<String> fields;

    public SchemaValidationException(String jobType, List<String> violations, List<String> fields) {
        super(ErrorCode.SCHEMA_VALIDATION_FAILED,
                "Payload validation failed for job type " + jobType + ": " + String.join("; ", violations));
        this.jobType = jobType;
        this.violations = List.copyOf(violations);
        this.fields = List.copyOf(fields);
    }
}
