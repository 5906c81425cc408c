package com.flagship.split_escrow.webhook;

/**
 * Authenticates an inbound webhook before anything in it is trusted.
 */
public interface WebhookSignatureVerifier {

    /**
     * @throws com.flagship.split_escrow.exception.InvalidSignatureException if the delivery is not authentic
     */
    void verify(String provider, String rawBody, String signature);
}
