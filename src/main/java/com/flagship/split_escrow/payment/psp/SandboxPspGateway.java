package com.flagship.split_escrow.payment.psp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process provider for local runs and tests. Every operation succeeds
 * immediately and is idempotent per key for the lifetime of the process.
 */
@Component
@Slf4j
public class SandboxPspGateway implements PspGateway {

    public static final String PROVIDER = "sandbox";

    private final Map<String, IntentResult> intents = new ConcurrentHashMap<>();
    private final Map<String, TransferResult> transfers = new ConcurrentHashMap<>();
    private final Map<String, RefundResult> refunds = new ConcurrentHashMap<>();

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public IntentResult createIntent(IntentRequest request) {
        return intents.computeIfAbsent(request.getIdempotencyKey(), key -> {
            String intentId = "sbx_pi_" + UUID.randomUUID().toString().replace("-", "");
            log.info("Sandbox intent created: intentId={}, amount={} {}",
                    intentId, request.getAmount(), request.getCurrency());
            return new IntentResult(intentId, intentId + "_secret", "https://sandbox.invalid/checkout/" + intentId);
        });
    }

    @Override
    public TransferResult captureAndTransfer(TransferRequest request) {
        return transfers.computeIfAbsent(request.getIdempotencyKey(), key -> {
            String transferId = "sbx_tr_" + UUID.randomUUID().toString().replace("-", "");
            log.info("Sandbox transfer executed: transferId={}, recipient={}, amount={} {}",
                    transferId, request.getRecipientId(), request.getAmount(), request.getCurrency());
            return TransferResult.succeeded(transferId);
        });
    }

    @Override
    public RefundResult refund(RefundRequest request) {
        return refunds.computeIfAbsent(request.getIdempotencyKey(), key -> {
            String refundId = "sbx_re_" + UUID.randomUUID().toString().replace("-", "");
            log.info("Sandbox refund executed: refundId={}, reference={}, amount={} {}",
                    refundId, request.getProviderReference(), request.getAmount(), request.getCurrency());
            return new RefundResult(refundId, PspStatus.SUCCEEDED, null);
        });
    }
}
