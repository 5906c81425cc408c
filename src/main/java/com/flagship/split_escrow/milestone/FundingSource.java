package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.util.UUID;

/**
 * The confirmed payment that funds a milestone's escrow.
 */
@Value
public class FundingSource {
    UUID transactionId;
    long amount;
    CurrencyCode currency;
    String provider;
    String providerReference;
}
