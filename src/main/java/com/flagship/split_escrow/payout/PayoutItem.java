package com.flagship.split_escrow.payout;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One transfer instruction inside a payout batch.
 *
 * {@code attempts} counts transfer submissions for this item and is
 * independent of the owning job's attempt counter.
 */
@Value
@Builder(toBuilder = true)
public class PayoutItem {
    UUID id;
    int position;
    UUID recipientId;
    BigDecimal percentage;
    long grossShare;
    long platformFeeShare;
    long taxWithheld;
    long netAmount;
    PayoutStatus status;
    int attempts;
    String providerTransferId;
    String failureReason;
    Instant paidAt;
    Instant updatedAt;

    /**
     * True if a transfer should be submitted for this item. An item that is
     * PROCESSING with a transfer id is waiting for the provider's webhook.
     */
    public boolean needsTransfer() {
        return status == PayoutStatus.SCHEDULED
                || status == PayoutStatus.FAILED
                || (status == PayoutStatus.PROCESSING && providerTransferId == null);
    }

    public PayoutItem startAttempt() {
        if (status == PayoutStatus.PAID) {
            throw new IllegalStateException("Payout item " + id + " is already paid");
        }
        return toBuilder()
                .status(PayoutStatus.PROCESSING)
                .attempts(attempts + 1)
                .failureReason(null)
                .updatedAt(Instant.now())
                .build();
    }

    public PayoutItem markPaid(String transferId) {
        if (status == PayoutStatus.PAID) {
            throw new IllegalStateException("Payout item " + id + " is already paid");
        }
        Instant now = Instant.now();
        return toBuilder()
                .status(PayoutStatus.PAID)
                .providerTransferId(transferId != null ? transferId : providerTransferId)
                .failureReason(null)
                .paidAt(now)
                .updatedAt(now)
                .build();
    }

    public PayoutItem markAwaitingConfirmation(String transferId) {
        if (status != PayoutStatus.PROCESSING) {
            throw new IllegalStateException("Payout item " + id + " is " + status + ", expected PROCESSING");
        }
        return toBuilder()
                .providerTransferId(transferId)
                .updatedAt(Instant.now())
                .build();
    }

    public PayoutItem markFailed(String reason) {
        if (status == PayoutStatus.PAID) {
            throw new IllegalStateException("Payout item " + id + " is already paid");
        }
        return toBuilder()
                .status(PayoutStatus.FAILED)
                .failureReason(reason)
                .updatedAt(Instant.now())
                .build();
    }

    public boolean isPaid() {
        return status == PayoutStatus.PAID;
    }
}
