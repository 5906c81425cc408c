package com.flagship.split_escrow.escrow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.job.FieldType;
import com.flagship.split_escrow.job.Job;
import com.flagship.split_escrow.job.JobDefinition;
import com.flagship.split_escrow.job.JobHandler;
import com.flagship.split_escrow.job.JobPolicy;
import com.flagship.split_escrow.job.JobSchema;
import com.flagship.split_escrow.job.NonRetryableJobException;
import com.flagship.split_escrow.payment.psp.PspStatus;
import com.flagship.split_escrow.payment.psp.RefundRequest;
import com.flagship.split_escrow.payment.psp.RefundResult;
import com.flagship.split_escrow.payment.psp.PspGatewayRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Returns the funds of a refunded escrow to the payer through the provider.
 * The escrow id is the refund idempotency key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowRefundHandler implements JobHandler {

    public static final String JOB_TYPE = "escrow.refund";

    private static final JobDefinition DEFINITION = new JobDefinition(
            JOB_TYPE,
            JobPolicy.of(5, 60, 2),
            JobSchema.builder().required("escrowId", FieldType.STRING).build());

    private final EscrowLedger escrowLedger;
    private final PspGatewayRegistry gateways;
    private final ObjectMapper objectMapper;

    @Override
    public JobDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String handle(Job job) {
        UUID escrowId = escrowId(job);
        Escrow escrow = escrowLedger.getEscrow(escrowId);

        if (escrow.getStatus() != EscrowStatus.REFUNDED) {
            throw new NonRetryableJobException("Escrow " + escrowId + " is " + escrow.getStatus() + ", not REFUNDED");
        }
        if (escrow.getRefundReference() != null) {
            return "already refunded: " + escrow.getRefundReference();
        }

        RefundResult result = gateways.get(escrow.getProvider()).refund(new RefundRequest(
                escrow.getProviderReference(), escrow.getAmount(), escrow.getCurrency(), escrowId.toString()));

        if (result.getStatus() == PspStatus.FAILED) {
            throw new IllegalStateException("Provider rejected refund for escrow " + escrowId + ": " + result.getFailureReason());
        }
        escrowLedger.recordRefundReference(escrowId, result.getProviderRefundId());
        return "refund " + result.getStatus().name().toLowerCase() + ": " + result.getProviderRefundId();
    }

    @Override
    public void onDeadLetter(Job job, String lastError) {
        log.error("CRITICAL escrow refund dead-lettered, funds still with provider: jobId={}, payload={}, lastError={}",
                job.getId(), job.getPayload(), lastError);
    }

    private UUID escrowId(Job job) {
        try {
            JsonNode payload = objectMapper.readTree(job.getPayload());
            return UUID.fromString(payload.path("escrowId").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new NonRetryableJobException("Invalid escrow.refund payload: " + e.getMessage());
        }
    }
}
