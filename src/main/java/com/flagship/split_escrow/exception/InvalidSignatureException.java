package com.flagship.split_escrow.exception;

public class InvalidSignatureException extends SettlementException {

    public InvalidSignatureException(String provider) {
        super(ErrorCode.INVALID_SIGNATURE, "Webhook signature verification failed for provider " + provider);
    }
}
