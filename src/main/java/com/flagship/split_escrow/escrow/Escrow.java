package com.flagship.split_escrow.escrow;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Funds held by the platform for exactly one milestone.
 *
 * Transitions return a new instance and reject illegal moves with
 * {@link IllegalStateException}.
 */
@Value
public class Escrow {
    UUID id;
    UUID milestoneId;
    UUID projectId;
    UUID transactionId;
    long amount;
    CurrencyCode currency;
    String provider;
    String providerReference;
    EscrowStatus status;
    String refundReference;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new escrow in LOCKED status.
     */
    public static Escrow lock(UUID milestoneId, UUID projectId, UUID transactionId, long amount,
                              CurrencyCode currency, String provider, String providerReference) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Escrow amount must be positive, got " + amount);
        }
        Instant now = Instant.now();
        return new Escrow(UUID.randomUUID(), milestoneId, projectId, transactionId, amount, currency,
                provider, providerReference, EscrowStatus.LOCKED, null, now, now);
    }

    public Escrow hold() {
        requireStatus("hold", EscrowStatus.LOCKED);
        return withStatus(EscrowStatus.HELD, refundReference);
    }

    public Escrow resume() {
        requireStatus("resume", EscrowStatus.HELD);
        return withStatus(EscrowStatus.LOCKED, refundReference);
    }

    public Escrow release() {
        requireStatus("release", EscrowStatus.LOCKED);
        return withStatus(EscrowStatus.RELEASED, refundReference);
    }

    public Escrow refund() {
        if (!status.isActive()) {
            throw new IllegalStateException(
                String.format("Cannot refund escrow %s in %s status. Only LOCKED or HELD escrows can be refunded.",
                    id, status));
        }
        return withStatus(EscrowStatus.REFUNDED, refundReference);
    }

    /**
     * Records the provider's refund id once the refund job has run.
     */
    public Escrow withRefundReference(String reference) {
        if (status != EscrowStatus.REFUNDED) {
            throw new IllegalStateException("Refund reference can only be recorded on a REFUNDED escrow");
        }
        return withStatus(status, reference);
    }

    public boolean isActive() {
        return status.isActive();
    }

    private void requireStatus(String operation, EscrowStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s escrow %s in %s status. Only %s escrows allow it.",
                    operation, id, status, expected));
        }
    }

    private Escrow withStatus(EscrowStatus newStatus, String newRefundReference) {
        return new Escrow(id, milestoneId, projectId, transactionId, amount, currency, provider,
                providerReference, newStatus, newRefundReference, createdAt, Instant.now());
    }
}
