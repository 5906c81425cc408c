package com.flagship.split_escrow.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published whenever a milestone changes status.
 */
@Value
public class MilestoneTransitionedEvent implements SettlementEvent {
    UUID eventId;
    UUID milestoneId;
    UUID projectId;
    String fromStatus;
    String toStatus;
    UUID actorId;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MilestoneTransitioned";

    public static MilestoneTransitionedEvent of(UUID milestoneId, UUID projectId, String fromStatus,
                                                String toStatus, UUID actorId, String reason) {
        return new MilestoneTransitionedEvent(UUID.randomUUID(), milestoneId, projectId,
                fromStatus, toStatus, actorId, reason, Instant.now());
    }

    @Override
    public String getAggregateType() {
        return "Milestone";
    }

    @Override
    public UUID getAggregateId() {
        return milestoneId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
