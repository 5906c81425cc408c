package com.flagship.split_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a payout item reaches {@code PAID} or {@code FAILED}.
 */
@Value
public class PayoutItemSettledEvent implements SettlementEvent {
    UUID eventId;
    UUID itemId;
    UUID batchId;
    UUID recipientId;
    long netAmount;
    String currency;
    String status;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutItemSettled";

    public static PayoutItemSettledEvent of(UUID itemId, UUID batchId, UUID recipientId, long netAmount,
                                            String currency, String status, String failureReason) {
        return new PayoutItemSettledEvent(UUID.randomUUID(), itemId, batchId, recipientId, netAmount,
                currency, status, failureReason, Instant.now());
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
