package com.flagship.split_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class JobDeadLetteredEvent implements SettlementEvent {
    UUID eventId;
    UUID jobId;
    String jobType;
    int attempts;
    String lastError;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JobDeadLettered";

    public static JobDeadLetteredEvent of(UUID jobId, String jobType, int attempts, String lastError) {
        return new JobDeadLetteredEvent(UUID.randomUUID(), jobId, jobType, attempts, lastError, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return "Job";
    }

    @Override
    public UUID getAggregateId() {
        return jobId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
