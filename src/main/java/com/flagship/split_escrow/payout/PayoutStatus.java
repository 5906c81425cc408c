package com.flagship.split_escrow.payout;

/**
 * Status shared by payout batches and their items.
 *
 * An item moves SCHEDULED -> PROCESSING -> PAID, or to FAILED when a transfer
 * is rejected. A FAILED item is attempted again on the next job run. A batch
 * is PAID once every item is paid and FAILED when its job gives up.
 */
public enum PayoutStatus {
    SCHEDULED,
    PROCESSING,
    PAID,
    FAILED
}
