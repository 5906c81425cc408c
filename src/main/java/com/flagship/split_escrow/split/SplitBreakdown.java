package com.flagship.split_escrow.split;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.util.List;

/**
 * Result of a split calculation. All amounts are in minor units.
 *
 * Invariant: {@code totalDistributed == netPool == grossAmount - platformFee - taxWithheld}.
 */
@Value
public class SplitBreakdown {
    long grossAmount;
    CurrencyCode currency;
    long platformFee;
    long taxWithheld;
    long netPool;
    long totalDistributed;
    List<RecipientShare> shares;
}
