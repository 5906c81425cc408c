package com.flagship.split_escrow.payout;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of claiming a payout item for a transfer attempt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferClaim {

    public enum Kind { CLAIMED, SKIPPED, ABORTED }

    Kind kind;
    PayoutItem item;
    String reason;

    static TransferClaim claimed(PayoutItem item) {
        return new TransferClaim(Kind.CLAIMED, item, null);
    }

    static TransferClaim skipped(PayoutItem item) {
        return new TransferClaim(Kind.SKIPPED, item, null);
    }

    static TransferClaim aborted(String reason) {
        return new TransferClaim(Kind.ABORTED, null, reason);
    }
}
