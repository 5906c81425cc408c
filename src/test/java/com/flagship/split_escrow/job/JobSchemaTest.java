package com.flagship.split_escrow.job;

import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.JobTypeNotFoundException;
import com.flagship.split_escrow.exception.SchemaValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobSchemaTest {

    private static final JobSchema PAYOUT_SCHEMA = JobSchema.builder()
            .required("batchId", FieldType.STRING)
            .required("escrowId", FieldType.STRING)
            .optional("isRetry", FieldType.BOOLEAN)
            .build();

    private static JobHandler handler(String type, JobSchema schema) {
        JobDefinition definition = new JobDefinition(type, JobPolicy.of(3, 10, 1), schema);
        return new JobHandler() {
            @Override
            public JobDefinition definition() {
                return definition;
            }

            @Override
            public String handle(Job job) {
                return "ok";
            }
        };
    }

    @Test
    @DisplayName("a payload missing one required field names that field")
    void missingOneField() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> PAYOUT_SCHEMA.validate("payout.execute", Map.of("batchId", UUID.randomUUID().toString())));

        assertEquals(ErrorCode.SCHEMA_VALIDATION_FAILED, e.getErrorCode());
        assertEquals(List.of("escrowId"), e.getFields());
        assertTrue(e.getMessage().contains("Missing required field: escrowId"));
    }

    @Test
    @DisplayName("a payload missing two required fields names both")
    void missingTwoFields() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> PAYOUT_SCHEMA.validate("payout.execute", Map.of()));

        assertEquals(2, e.getViolations().size());
        assertTrue(e.getFields().containsAll(List.of("batchId", "escrowId")));
    }

    @Test
    @DisplayName("wrong field types are reported with expected and actual type")
    void wrongTypes() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("batchId", 42);
        payload.put("escrowId", UUID.randomUUID().toString());
        payload.put("isRetry", "yes");

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> PAYOUT_SCHEMA.validate("payout.execute", payload));

        assertEquals(List.of("batchId", "isRetry"), e.getFields());
        assertTrue(e.getViolations().get(0).contains("expected string, got number"));
        assertTrue(e.getViolations().get(1).contains("expected boolean, got string"));
    }

    @Test
    @DisplayName("valid payloads and absent optional fields pass")
    void validPayload() {
        assertDoesNotThrow(() -> PAYOUT_SCHEMA.validate("payout.execute", Map.of(
                "batchId", UUID.randomUUID().toString(),
                "escrowId", UUID.randomUUID().toString())));
        assertDoesNotThrow(() -> PAYOUT_SCHEMA.validate("payout.execute", Map.of(
                "batchId", UUID.randomUUID().toString(),
                "escrowId", UUID.randomUUID().toString(),
                "isRetry", true)));
    }

    @Test
    @DisplayName("registry rejects unknown types and duplicate registrations")
    void registryLookups() {
        JobRegistry registry = new JobRegistry(List.of(handler("test.echo", JobSchema.builder().build())));

        assertTrue(registry.isRegistered("test.echo"));
        assertThrows(JobTypeNotFoundException.class, () -> registry.handlerFor("test.unknown"));
        assertThrows(JobTypeNotFoundException.class, () -> registry.validate("test.unknown", Map.of()));
        assertThrows(IllegalStateException.class,
                () -> registry.register(handler("test.echo", JobSchema.builder().build())));
    }

    @Test
    @DisplayName("registry validates payloads against the registered schema")
    void registryValidates() {
        JobRegistry registry = new JobRegistry(List.of(handler("payout.execute", PAYOUT_SCHEMA)));

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> registry.validate("payout.execute", Map.of("escrowId", UUID.randomUUID().toString())));
        assertEquals(List.of("batchId"), e.getFields());
    }

    @Test
    @DisplayName("job policy rejects non-positive limits")
    void policyValidation() {
        assertThrows(IllegalArgumentException.class, () -> JobPolicy.of(0, 10, 1));
        assertThrows(IllegalArgumentException.class, () -> JobPolicy.of(3, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> JobPolicy.of(3, 10, 0));
    }
}
