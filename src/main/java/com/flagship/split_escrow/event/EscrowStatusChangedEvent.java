package com.flagship.split_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EscrowStatusChangedEvent implements SettlementEvent {
    UUID eventId;
    UUID escrowId;
    UUID milestoneId;
    UUID projectId;
    long amount;
    String currency;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowStatusChanged";

    public static EscrowStatusChangedEvent of(UUID escrowId, UUID milestoneId, UUID projectId,
                                              long amount, String currency, String status) {
        return new EscrowStatusChangedEvent(UUID.randomUUID(), escrowId, milestoneId, projectId,
                amount, currency, status, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return "Escrow";
    }

    @Override
    public UUID getAggregateId() {
        return escrowId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
