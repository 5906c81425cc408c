package com.flagship.split_escrow.webhook;

import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.milestone.FundingSource;
import com.flagship.split_escrow.milestone.MilestoneStateMachine;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.payment.PaymentOutcomeService;
import com.flagship.split_escrow.payment.PaymentTransaction;
import com.flagship.split_escrow.payment.TransactionStatus;
import com.flagship.split_escrow.payout.PayoutBatch;
import com.flagship.split_escrow.payout.PayoutBatchService;
import com.flagship.split_escrow.payout.PayoutExecutionHandler;
import com.flagship.split_escrow.port.JobQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps provider events onto transaction, escrow and payout state.
 *
 * Deliveries may be duplicated and arrive in any order. The provider
 * correlation id (the internal transaction id) is the idempotency key: once a
 * transaction is terminal, every later delivery for it is a DUPLICATE with no
 * side effects.
 *
 * Marking the transaction and funding the milestone commit separately, so a
 * funding conflict never reverts a payment the provider already confirmed.
 * A duplicate that finds a SUCCEEDED transaction without an escrow while the
 * milestone is still PENDING completes the funding that was interrupted. If
 * a concurrent delivery wins that race, the loser answers DUPLICATE.
 */
@Service
@Slf4j
public class WebhookReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookEventParser parser;
    private final WebhookDeliveryCache deliveryCache;
    private final PaymentOutcomeService paymentOutcomeService;
    private final MilestoneStateMachine stateMachine;
    private final EscrowLedger escrowLedger;
    private final PayoutBatchService payoutBatchService;
    private final JobQueuePort jobQueue;
    private final SettlementMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public WebhookReconciler(WebhookSignatureVerifier signatureVerifier,
                             WebhookEventParser parser,
                             WebhookDeliveryCache deliveryCache,
                             PaymentOutcomeService paymentOutcomeService,
                             MilestoneStateMachine stateMachine,
                             EscrowLedger escrowLedger,
                             PayoutBatchService payoutBatchService,
                             JobQueuePort jobQueue,
                             SettlementMetrics metrics,
                             PlatformTransactionManager transactionManager) {
        this.signatureVerifier = signatureVerifier;
        this.parser = parser;
        this.deliveryCache = deliveryCache;
        this.paymentOutcomeService = paymentOutcomeService;
        this.stateMachine = stateMachine;
        this.escrowLedger = escrowLedger;
        this.payoutBatchService = payoutBatchService;
        this.jobQueue = jobQueue;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public WebhookOutcome receive(String provider, String rawBody, String signature) {
        signatureVerifier.verify(provider, rawBody, signature);
        WebhookEvent event = parser.parse(rawBody);

        WebhookOutcome outcome;
        if (event.getKind().isPayment()) {
            outcome = reconcilePayment(provider, event);
        } else if (event.getKind().isTransfer()) {
            outcome = reconcileTransfer(provider, event);
        } else {
            log.info("Webhook ignored: provider={}, type={}", provider, event.getType());
            outcome = WebhookOutcome.IGNORED;
        }

        metrics.recordWebhookOutcome(provider, outcome.name());
        return outcome;
    }

    private WebhookOutcome reconcilePayment(String provider, WebhookEvent event) {
        if (event.getCorrelationId() == null) {
            throw new ValidationException(ErrorCode.CORRELATION_MISSING,
                    "Webhook " + event.getType() + " carries no correlation id");
        }
        UUID transactionId = parseCorrelationId(event.getCorrelationId());
        String deliveryKey = transactionId.toString();

        if (deliveryCache.isKnown(provider, deliveryKey)) {
            log.info("Duplicate webhook (cache): provider={}, transactionId={}", provider, transactionId);
            return WebhookOutcome.DUPLICATE;
        }

        PaymentOutcomeService.RecordedOutcome recorded = paymentOutcomeService.recordOutcome(
                provider, transactionId, event.getObjectId(),
                event.getKind() == WebhookEventKind.PAYMENT_SUCCEEDED,
                event.getFailureReason() != null ? event.getFailureReason() : event.getType());
        PaymentTransaction transaction = recorded.getTransaction();

        if (recorded.isDuplicate()) {
            if (needsFundingRepair(transaction) && completeInterruptedFunding(transaction)) {
                deliveryCache.remember(provider, deliveryKey);
                return WebhookOutcome.PROCESSED;
            }
            log.info("Duplicate webhook: provider={}, transactionId={}, status={}",
                    provider, transactionId, transaction.getStatus());
            deliveryCache.remember(provider, deliveryKey);
            return WebhookOutcome.DUPLICATE;
        }

        if (transaction.getStatus() == TransactionStatus.SUCCEEDED && !fundUnlessFundedConcurrently(transaction)) {
            deliveryCache.remember(provider, deliveryKey);
            return WebhookOutcome.DUPLICATE;
        }
        deliveryCache.remember(provider, deliveryKey);
        return WebhookOutcome.PROCESSED;
    }

    private boolean needsFundingRepair(PaymentTransaction transaction) {
        return transaction.getStatus() == TransactionStatus.SUCCEEDED
                && !escrowLedger.hasEscrowForTransaction(transaction.getId())
                && stateMachine.isAwaitingFunding(transaction.getMilestoneId());
    }

    /**
     * @return false if a concurrent delivery of the same payment funded the milestone first
     */
    private boolean completeInterruptedFunding(PaymentTransaction transaction) {
        log.warn("Completing interrupted funding: transactionId={}, milestoneId={}",
                transaction.getId(), transaction.getMilestoneId());
        try {
            fund(transaction);
            return true;
        } catch (ConflictException e) {
            if (!escrowLedger.hasEscrowForTransaction(transaction.getId())) {
                throw e;
            }
            log.info("Funding already completed elsewhere: transactionId={}, milestoneId={}, reason={}",
                    transaction.getId(), transaction.getMilestoneId(), e.getErrorCode());
            return false;
        }
    }

    /**
     * Funds the milestone from a newly confirmed payment. A duplicate delivery
     * may have completed the same funding in the meantime; that counts as done.
     * An escrow held by another transaction is still a conflict.
     *
     * @return false if the escrow for this transaction was created by a concurrent delivery
     */
    private boolean fundUnlessFundedConcurrently(PaymentTransaction transaction) {
        try {
            fund(transaction);
            return true;
        } catch (ConflictException e) {
            if (e.getErrorCode() == ErrorCode.ESCROW_ALREADY_ACTIVE
                    && escrowLedger.hasEscrowForTransaction(transaction.getId())) {
                log.info("Funding completed by a concurrent delivery: transactionId={}", transaction.getId());
                return false;
            }
            throw e;
        }
    }

    private void fund(PaymentTransaction transaction) {
        stateMachine.fund(transaction.getMilestoneId(), new FundingSource(
                transaction.getId(),
                transaction.getAmount(),
                transaction.getCurrency(),
                transaction.getProvider(),
                transaction.getProviderIntentId()));
    }

    private WebhookOutcome reconcileTransfer(String provider, WebhookEvent event) {
        UUID itemId = event.getPayoutItemId() != null ? parseCorrelationId(event.getPayoutItemId()) : null;
        if (itemId == null && event.getObjectId() == null) {
            throw new ValidationException(ErrorCode.CORRELATION_MISSING,
                    "Transfer webhook " + event.getType() + " identifies no payout item");
        }
        boolean succeeded = event.getKind() == WebhookEventKind.TRANSFER_PAID;
        String deliveryKey = "transfer:" + (itemId != null ? itemId : event.getObjectId()) + ":" + event.getKind();

        if (deliveryCache.isKnown(provider, deliveryKey)) {
            return WebhookOutcome.DUPLICATE;
        }

        Optional<PayoutBatch> applied = transactionTemplate.execute(status -> {
            Optional<PayoutBatch> batch = payoutBatchService.applyTransferWebhook(
                    itemId, event.getObjectId(), succeeded, event.getFailureReason());
            batch.filter(updated -> !succeeded).ifPresent(updated ->
                    jobQueue.enqueue(PayoutExecutionHandler.JOB_TYPE, Map.of(
                            "batchId", updated.getId().toString(),
                            "escrowId", updated.getEscrowId().toString(),
                            "isRetry", true)));
            return batch;
        });

        deliveryCache.remember(provider, deliveryKey);
        if (applied.isEmpty()) {
            return WebhookOutcome.DUPLICATE;
        }
        log.info("Transfer reconciled: provider={}, itemId={}, transferId={}, paid={}",
                provider, itemId, event.getObjectId(), succeeded);
        return WebhookOutcome.PROCESSED;
    }

    private static UUID parseCorrelationId(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "Correlation id is not a UUID: " + value);
        }
    }
}
