package com.flagship.split_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per escrow when its payout batch is created.
 */
@Value
public class PayoutBatchScheduledEvent implements SettlementEvent {
    UUID eventId;
    UUID batchId;
    UUID escrowId;
    UUID projectId;
    String currency;
    long totalNet;
    long withheldAmount;
    List<UUID> recipientIds;
    UUID jobId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutBatchScheduled";

    public static PayoutBatchScheduledEvent of(UUID batchId, UUID escrowId, UUID projectId, String currency,
                                               long totalNet, long withheldAmount, List<UUID> recipientIds,
                                               UUID jobId) {
        return new PayoutBatchScheduledEvent(UUID.randomUUID(), batchId, escrowId, projectId, currency,
                totalNet, withheldAmount, List.copyOf(recipientIds), jobId, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return "PayoutBatch";
    }

    @Override
    public UUID getAggregateId() {
        return batchId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
