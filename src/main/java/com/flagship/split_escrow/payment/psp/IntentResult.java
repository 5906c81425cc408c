package com.flagship.split_escrow.payment.psp;

import lombok.Value;

/**
 * Provider handle for a pay-in. {@code clientSecret} and {@code checkoutUrl}
 * are passed to the payer's client and may be null depending on the provider.
 */
@Value
public class IntentResult {
    String providerIntentId;
    String clientSecret;
    String checkoutUrl;
}
