package com.flagship.split_escrow.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.split_escrow.port.NotificationPort;
import com.flagship.split_escrow.project.ProjectEntity;
import com.flagship.split_escrow.project.ProjectService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns settlement events into user notifications.
 *
 * Called by {@link SettlementEventConsumer} after the idempotency check, so
 * each notification is sent once per event.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventHandler {

    private final NotificationPort notifications;
    private final ProjectService projectService;

    /**
     * Tells every project participant that a milestone moved.
     */
    public void onMilestoneTransitioned(JsonNode event) {
        UUID projectId = UUID.fromString(event.get("projectId").asText());
        UUID milestoneId = UUID.fromString(event.get("milestoneId").asText());
        String toStatus = event.path("toStatus").asText();

        Map<String, Object> data = new HashMap<>();
        data.put("milestoneId", milestoneId);
        data.put("projectId", projectId);
        data.put("fromStatus", event.path("fromStatus").asText());
        data.put("toStatus", toStatus);
        if (event.hasNonNull("reason")) {
            data.put("reason", event.get("reason").asText());
        }

        ProjectEntity project = projectService.getProject(projectId);
        Set<UUID> audience = new LinkedHashSet<>();
        audience.add(project.getOwnerId());
        audience.addAll(project.getMemberIds());

        String template = "milestone." + toStatus.toLowerCase();
        audience.forEach(recipient -> notifications.notify(recipient, template, data));
        log.info("Milestone notification sent: milestoneId={}, status={}, recipients={}",
                milestoneId, toStatus, audience.size());
    }

    public void onPayoutBatchScheduled(JsonNode event) {
        Map<String, Object> data = Map.of(
                "batchId", event.get("batchId").asText(),
                "currency", event.path("currency").asText());
        for (JsonNode recipient : event.path("recipientIds")) {
            notifications.notify(UUID.fromString(recipient.asText()), "payout.scheduled", data);
        }
    }

    public void onPayoutItemSettled(JsonNode event) {
        UUID recipientId = UUID.fromString(event.get("recipientId").asText());
        String status = event.path("status").asText();

        Map<String, Object> data = new HashMap<>();
        data.put("itemId", event.get("itemId").asText());
        data.put("batchId", event.get("batchId").asText());
        data.put("netAmount", event.path("netAmount").asLong());
        data.put("currency", event.path("currency").asText());
        if (event.hasNonNull("failureReason")) {
            data.put("failureReason", event.get("failureReason").asText());
        }

        notifications.notify(recipientId, "payout." + status.toLowerCase(), data);
    }

    public void onJobDeadLettered(JsonNode event) {
        log.error("ALERT job dead-lettered: jobId={}, type={}, attempts={}, lastError={}",
                event.path("jobId").asText(), event.path("jobType").asText(),
                event.path("attempts").asInt(), event.path("lastError").asText());
    }
}
