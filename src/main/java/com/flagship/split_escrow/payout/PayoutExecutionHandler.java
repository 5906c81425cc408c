package com.flagship.split_escrow.payout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.job.FieldType;
import com.flagship.split_escrow.job.Job;
import com.flagship.split_escrow.job.JobDefinition;
import com.flagship.split_escrow.job.JobHandler;
import com.flagship.split_escrow.job.JobPolicy;
import com.flagship.split_escrow.job.JobSchema;
import com.flagship.split_escrow.job.NonRetryableJobException;
import com.flagship.split_escrow.observability.CorrelationContext;
import com.flagship.split_escrow.payment.psp.PspGateway;
import com.flagship.split_escrow.payment.psp.PspGatewayRegistry;
import com.flagship.split_escrow.payment.psp.TransferRequest;
import com.flagship.split_escrow.payment.psp.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Executes a payout batch: one provider transfer per item that still needs one.
 *
 * Items are claimed one at a time under the batch lock, and each claim
 * re-checks that the escrow is still RELEASED. The payout item id is the
 * transfer idempotency key, so a job retry never pays an item twice. Paid
 * items and items awaiting a transfer webhook are skipped.
 *
 * If any transfer failed the job fails and is retried with backoff; only the
 * failed items are attempted again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayoutExecutionHandler implements JobHandler {

    public static final String JOB_TYPE = "payout.execute";

    private static final JobDefinition DEFINITION = new JobDefinition(
            JOB_TYPE,
            JobPolicy.of(10, 60, 5),
            JobSchema.builder()
                    .required("batchId", FieldType.STRING)
                    .required("escrowId", FieldType.STRING)
                    .optional("isRetry", FieldType.BOOLEAN)
                    .build());

    private final PayoutBatchService batchService;
    private final EscrowLedger escrowLedger;
    private final PspGatewayRegistry gateways;
    private final ObjectMapper objectMapper;

    @Override
    public JobDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String handle(Job job) {
        UUID batchId = payloadId(job, "batchId");
        UUID escrowId = payloadId(job, "escrowId");
        MDC.put(CorrelationContext.BATCH_ID_MDC_KEY, batchId.toString());
        try {
            PayoutBatch batch = batchService.getBatch(batchId);
            if (!batch.getEscrowId().equals(escrowId)) {
                throw new NonRetryableJobException(
                        "Batch " + batchId + " belongs to escrow " + batch.getEscrowId() + ", not " + escrowId);
            }
            Escrow escrow = escrowLedger.getEscrow(escrowId);
            PspGateway gateway = gateways.get(escrow.getProvider());

            int paid = 0;
            int pending = 0;
            int failed = 0;
            int skipped = 0;
            for (PayoutItem item : batch.getItems()) {
                TransferClaim claim = batchService.claimItem(batchId, item.getId());
                if (claim.getKind() == TransferClaim.Kind.ABORTED) {
                    throw new NonRetryableJobException(claim.getReason());
                }
                if (claim.getKind() == TransferClaim.Kind.SKIPPED) {
                    skipped++;
                    continue;
                }

                PayoutItem claimed = claim.getItem();
                TransferResult result = transfer(gateway, escrow, batch, claimed);
                batchService.recordTransferResult(batchId, claimed.getId(), result);

                switch (result.getStatus()) {
                    case SUCCEEDED -> paid++;
                    case PENDING -> pending++;
                    case FAILED -> failed++;
                }
            }

            String summary = String.format("paid=%d, pending=%d, failed=%d, skipped=%d", paid, pending, failed, skipped);
            log.info("Payout batch run finished: batchId={}, {}", batchId, summary);
            if (failed > 0) {
                throw new IllegalStateException(failed + " payout transfer(s) failed in batch " + batchId);
            }
            return summary;
        } finally {
            MDC.remove(CorrelationContext.BATCH_ID_MDC_KEY);
        }
    }

    @Override
    public void onDeadLetter(Job job, String lastError) {
        UUID batchId = payloadId(job, "batchId");
        UUID escrowId = payloadId(job, "escrowId");
        PayoutBatch batch = batchService.getBatch(batchId);
        if (!batch.getEscrowId().equals(escrowId)) {
            log.warn("Dead-lettered payout job does not own batch {}: payload escrow {}, batch escrow {}",
                    batchId, escrowId, batch.getEscrowId());
            return;
        }
        batchService.markFailed(batchId, lastError);
    }

    private TransferResult transfer(PspGateway gateway, Escrow escrow, PayoutBatch batch, PayoutItem item) {
        if (item.getNetAmount() == 0) {
            return TransferResult.succeeded(null);
        }
        TransferRequest request = new TransferRequest(
                escrow.getProviderReference(),
                item.getRecipientId(),
                item.getNetAmount(),
                batch.getCurrency(),
                item.getId().toString(),
                Map.of("payoutItemId", item.getId().toString(), "batchId", batch.getId().toString()));
        try {
            TransferResult result = gateway.captureAndTransfer(request);
            if (result == null || result.getStatus() == null) {
                return TransferResult.failed("Provider returned no transfer status");
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Transfer call failed: itemId={}, recipient={}, amount={}",
                    item.getId(), item.getRecipientId(), item.getNetAmount(), e);
            return TransferResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private UUID payloadId(Job job, String field) {
        try {
            JsonNode payload = objectMapper.readTree(job.getPayload());
            JsonNode value = payload.get(field);
            if (value == null || !value.isTextual()) {
                throw new NonRetryableJobException("Payload field " + field + " is missing");
            }
            return UUID.fromString(value.asText());
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException("Unreadable payload: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new NonRetryableJobException("Payload field " + field + " is not a UUID");
        }
    }
}
