package com.flagship.split_escrow.payment.psp;

import com.flagship.split_escrow.common.CurrencyCode;
import lombok.Value;

import java.util.Map;

@Value
public class IntentRequest {
    long amount;
    CurrencyCode currency;
    String idempotencyKey;
    Map<String, String> metadata;
}
