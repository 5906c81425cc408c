package com.flagship.split_escrow.payment.psp;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

@Value
public class RefundRequest {
    String providerReference;
    long amount;
    CurrencyCode currency;
    String idempotencyKey;
}
