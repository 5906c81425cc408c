package com.flagship.split_escrow.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.project.ProjectController;
import com.flagship.split_escrow.webhook.WebhookController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface: request mapping, actor header handling and the error body
 * contract.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Settlement API Tests")
class SettlementApiTest {

    private static final String ACTOR = ProjectController.ACTOR_HEADER;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private UUID createProject(UUID owner, UUID... members) throws Exception {
        StringBuilder memberJson = new StringBuilder();
        for (UUID member : members) {
            memberJson.append(memberJson.length() == 0 ? "" : ",").append('"').append(member).append('"');
        }
        MvcResult result = mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"EP\",\"owner_id\":\"" + owner + "\",\"member_ids\":[" + memberJson + "]}"))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(body(result).get("project_id").asText());
    }

    private void putSplits(UUID projectId, UUID owner, String splitsJson) throws Exception {
        mockMvc.perform(put("/api/projects/{id}/splits", projectId)
                        .header(ACTOR, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"splits\":" + splitsJson + "}"))
                .andExpect(status().isOk());
    }

    private UUID createMilestone(UUID projectId, UUID owner, long amount) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/projects/{id}/milestones", projectId)
                        .header(ACTOR, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Master\",\"amount\":" + amount + ",\"currency\":\"USD\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        return UUID.fromString(body(result).get("milestone_id").asText());
    }

    @Test
    @DisplayName("a milestone is funded, completed, approved and paid out over HTTP")
    void settlementFlow() throws Exception {
        printTestHeader("Settlement over HTTP");
        UUID owner = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        UUID projectId = createProject(owner, first, second);
        putSplits(projectId, owner, "[{\"recipient_id\":\"" + first + "\",\"percentage\":60},"
                + "{\"recipient_id\":\"" + second + "\",\"percentage\":40}]");

        mockMvc.perform(post("/api/splits/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":10000,\"currency\":\"USD\",\"project_id\":\"" + projectId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform_fee").value(500))
                .andExpect(jsonPath("$.total_distributed").value(9500))
                .andExpect(jsonPath("$.breakdown[0].net_amount").value(5700))
                .andExpect(jsonPath("$.breakdown[1].net_amount").value(3800));

        UUID milestoneId = createMilestone(projectId, owner, 10_000);

        JsonNode intent = body(mockMvc.perform(post("/api/payments/intents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payer_id\":\"" + UUID.randomUUID() + "\",\"milestone_id\":\"" + milestoneId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andReturn());

        String webhook = "{\"type\":\"payment_intent.succeeded\",\"data\":{\"object\":{\"id\":\""
                + intent.get("provider_intent_id").asText() + "\",\"metadata\":{\"internalIntentId\":\""
                + intent.get("transaction_id").asText() + "\"}}}}";
        mockMvc.perform(post("/api/webhooks/sandbox")
                        .header(WebhookController.SIGNATURE_HEADER, "test-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(webhook))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("PROCESSED"));

        mockMvc.perform(get("/api/milestones/{id}", milestoneId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FUNDED"));

        mockMvc.perform(post("/api/milestones/{id}/complete", milestoneId).header(ACTOR, first))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        JsonNode approved = body(mockMvc.perform(post("/api/milestones/{id}/approve", milestoneId).header(ACTOR, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andReturn());

        mockMvc.perform(get("/api/payouts/batches/{id}", approved.get("payout_batch_id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SCHEDULED"))
                .andExpect(jsonPath("$.total_net").value(9500))
                .andExpect(jsonPath("$.items.length()").value(2));

        printSuccess("Milestone " + milestoneId + " approved with batch " + approved.get("payout_batch_id").asText());
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("an invalid split sum is a 400 with its error code")
        void invalidSplitSum() throws Exception {
            UUID owner = UUID.randomUUID();
            UUID projectId = createProject(owner);

            mockMvc.perform(put("/api/projects/{id}/splits", projectId)
                            .header(ACTOR, owner)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"splits\":[{\"recipient_id\":\"" + UUID.randomUUID() + "\",\"percentage\":90}]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("SPLIT_SUM_INVALID"));
        }

        @Test
        @DisplayName("a non-owner approval is a 403")
        void permissionDenied() throws Exception {
            UUID owner = UUID.randomUUID();
            UUID projectId = createProject(owner);
            UUID milestoneId = createMilestone(projectId, owner, 1_000);

            mockMvc.perform(post("/api/milestones/{id}/approve", milestoneId).header(ACTOR, UUID.randomUUID()))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("PERMISSION_DENIED"));
        }

        @Test
        @DisplayName("a missing actor header is a 400")
        void missingActor() throws Exception {
            mockMvc.perform(post("/api/milestones/{id}/complete", UUID.randomUUID()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("MISSING_HEADER"));
        }

        @Test
        @DisplayName("an unknown milestone is a 404")
        void unknownMilestone() throws Exception {
            mockMvc.perform(get("/api/milestones/{id}", UUID.randomUUID()))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("MILESTONE_NOT_FOUND"));
        }

        @Test
        @DisplayName("a webhook with a bad signature is a 401")
        void badSignature() throws Exception {
            mockMvc.perform(post("/api/webhooks/sandbox")
                            .header(WebhookController.SIGNATURE_HEADER, "nope")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"type\":\"payment_intent.succeeded\"}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));
        }

        @Test
        @DisplayName("a job payload missing fields is a 400 naming every field")
        void schemaViolation() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"type\":\"payout.execute\",\"payload\":{}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("SCHEMA_VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.details.batchId").exists())
                    .andExpect(jsonPath("$.details.escrowId").exists());
        }

        @Test
        @DisplayName("bean validation failures list the offending fields")
        void beanValidation() throws Exception {
            mockMvc.perform(post("/api/projects")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.details.owner_id").doesNotExist())
                    .andExpect(jsonPath("$.details.ownerId").exists());
        }
    }

    @Test
    @DisplayName("jobs can be enqueued and inspected, and only dead-lettered jobs are requeued")
    void jobEndpoints() throws Exception {
        JsonNode job = body(mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"escrow.refund\",\"payload\":{\"escrowId\":\"" + UUID.randomUUID()
                                + "\"},\"priority\":70,\"run_at\":\"2099-01-01T00:00:00Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.priority").value(70))
                .andReturn());
        String jobId = job.get("id").asText();

        mockMvc.perform(get("/api/jobs/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("escrow.refund"));
        mockMvc.perform(get("/api/jobs/dead-letter"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/jobs/{id}/requeue", jobId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
        mockMvc.perform(get("/api/jobs/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("health endpoint reports the database")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("UP"));
    }
}
