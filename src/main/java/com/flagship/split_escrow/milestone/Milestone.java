package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Milestone domain object.
 *
 * Key principles:
 * - Status transitions are explicit and validated against {@link MilestoneStatus#canTransitionTo}
 * - Invalid transitions are rejected with {@link IllegalStateException}
 * - State changes are immutable (each transition returns a new Milestone)
 *
 * Business preconditions that need other aggregates (an active escrow,
 * project roles) are checked by {@link MilestoneStateMachine}.
 */
@Value
public class Milestone {
    UUID id;
    UUID projectId;
    String title;
    long amount;
    CurrencyCode currency;
    MilestoneStatus status;
    UUID escrowId;
    String disputeReason;
    Instant createdAt;
    Instant updatedAt;

    public static Milestone create(UUID projectId, String title, long amount, CurrencyCode currency) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Milestone amount must be positive, got " + amount);
        }
        if (currency == null) {
            throw new IllegalArgumentException("Milestone currency is required");
        }
        Instant now = Instant.now();
        return new Milestone(UUID.randomUUID(), projectId, title, amount, currency,
                MilestoneStatus.PENDING, null, null, now, now);
    }

    public Milestone fund(UUID fundingEscrowId) {
        requireTransition(MilestoneStatus.FUNDED);
        return new Milestone(id, projectId, title, amount, currency, MilestoneStatus.FUNDED,
                fundingEscrowId, disputeReason, createdAt, Instant.now());
    }

    public Milestone complete() {
        return moveTo(MilestoneStatus.COMPLETED);
    }

    public Milestone approve() {
        return moveTo(MilestoneStatus.APPROVED);
    }

    public Milestone dispute(String reason) {
        requireTransition(MilestoneStatus.DISPUTED);
        return new Milestone(id, projectId, title, amount, currency, MilestoneStatus.DISPUTED,
                escrowId, reason, createdAt, Instant.now());
    }

    public Milestone reject() {
        return moveTo(MilestoneStatus.REJECTED);
    }

    private Milestone moveTo(MilestoneStatus target) {
        requireTransition(target);
        return new Milestone(id, projectId, title, amount, currency, target,
                escrowId, disputeReason, createdAt, Instant.now());
    }

    private void requireTransition(MilestoneStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move milestone %s from %s to %s", id, status, target));
        }
    }
}
