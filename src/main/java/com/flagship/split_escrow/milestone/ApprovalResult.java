package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.payout.PayoutBatch;
import lombok.Value;

/**
 * Outcome of approving a milestone: the released escrow and the payout batch
 * scheduled from it in the same transaction.
 */
@Value
public class ApprovalResult {
    Milestone milestone;
    Escrow escrow;
    PayoutBatch payoutBatch;
}
