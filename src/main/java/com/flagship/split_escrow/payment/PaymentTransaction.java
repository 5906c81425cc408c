package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payer's funding payment for one milestone.
 *
 * The transaction id travels to the provider as intent metadata and comes
 * back in webhooks as the correlation id.
 */
@Value
public class PaymentTransaction {
    UUID id;
    UUID payerId;
    UUID projectId;
    UUID milestoneId;
    long amount;
    CurrencyCode currency;
    String provider;
    String providerIntentId;
    TransactionStatus status;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentTransaction create(UUID payerId, UUID projectId, UUID milestoneId, long amount,
                                            CurrencyCode currency, String provider) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive, got " + amount);
        }
        Instant now = Instant.now();
        return new PaymentTransaction(UUID.randomUUID(), payerId, projectId, milestoneId, amount, currency,
                provider, null, TransactionStatus.CREATED, null, now, now);
    }

    public PaymentTransaction withProviderIntent(String intentId) {
        if (providerIntentId != null) {
            throw new IllegalStateException("Transaction " + id + " already has provider intent " + providerIntentId);
        }
        return copy(intentId, status, failureReason);
    }

    public PaymentTransaction markPending() {
        requireOpen("mark pending");
        return copy(providerIntentId, TransactionStatus.PENDING, null);
    }

    public PaymentTransaction markSucceeded() {
        requireOpen("succeed");
        return copy(providerIntentId, TransactionStatus.SUCCEEDED, null);
    }

    public PaymentTransaction markFailed(String reason) {
        requireOpen("fail");
        return copy(providerIntentId, TransactionStatus.FAILED, reason);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireOpen(String operation) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot %s transaction %s in %s status.", operation, id, status));
        }
    }

    private PaymentTransaction copy(String intentId, TransactionStatus newStatus, String reason) {
        return new PaymentTransaction(id, payerId, projectId, milestoneId, amount, currency, provider,
                intentId, newStatus, reason, createdAt, Instant.now());
    }
}
