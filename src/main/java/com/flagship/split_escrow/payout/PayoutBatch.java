package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Payout instructions derived from one released escrow.
 *
 * Invariants:
 * - at most one batch per escrow
 * - {@code totalNet} equals the sum of item net amounts
 * - {@code totalNet + withheldAmount == netPool}
 */
@Value
@Builder(toBuilder = true)
public class PayoutBatch {
    UUID id;
    UUID escrowId;
    UUID projectId;
    UUID milestoneId;
    CurrencyCode currency;
    long grossAmount;
    long platformFee;
    long netPool;
    long totalNet;
    long withheldAmount;
    PlaceholderPolicy placeholderPolicy;
    PayoutStatus status;
    UUID jobId;
    List<PayoutItem> items;
    Instant createdAt;
    Instant updatedAt;

    public boolean allItemsPaid() {
        return !items.isEmpty() && items.stream().allMatch(PayoutItem::isPaid);
    }

    /**
     * Batch status implied by the item statuses. A batch that was failed by
     * its job stays FAILED until every item is paid.
     */
    public PayoutStatus derivedStatus() {
        if (allItemsPaid()) {
            return PayoutStatus.PAID;
        }
        if (status == PayoutStatus.FAILED) {
            return PayoutStatus.FAILED;
        }
        boolean started = items.stream().anyMatch(item -> item.getStatus() != PayoutStatus.SCHEDULED);
        return started ? PayoutStatus.PROCESSING : PayoutStatus.SCHEDULED;
    }
}
