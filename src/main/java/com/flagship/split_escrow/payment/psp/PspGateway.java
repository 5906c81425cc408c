package com.flagship.split_escrow.payment.psp;

/**
 * Payment service provider operations used by the settlement engine.
 *
 * Every call carries an idempotency key. Implementations must return the
 * original result when called again with a key they have already seen.
 */
public interface PspGateway {

    /**
     * Name used in webhook paths and stored on transactions and escrows.
     */
    String providerName();

    IntentResult createIntent(IntentRequest request);

    TransferResult captureAndTransfer(TransferRequest request);

    RefundResult refund(RefundRequest request);
}
