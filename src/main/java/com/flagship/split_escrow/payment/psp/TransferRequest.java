package com.flagship.split_escrow.payment.psp;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Moves {@code amount} from a captured pay-in to a recipient.
 * {@code idempotencyKey} is stable per payout item so a retried transfer is
 * never executed twice by the provider.
 */
@Value
public class TransferRequest {
    String providerReference;
    UUID recipientId;
    long amount;
    CurrencyCode currency;
    String idempotencyKey;
    Map<String, String> metadata;
}
