package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.milestone.Milestone;
import com.flagship.split_escrow.milestone.MilestoneStateMachine;
import com.flagship.split_escrow.milestone.MilestoneStatus;
import com.flagship.split_escrow.payment.psp.IntentRequest;
import com.flagship.split_escrow.payment.psp.IntentResult;
import com.flagship.split_escrow.payment.psp.PspGateway;
import com.flagship.split_escrow.payment.psp.PspGatewayRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Starts the pay-in for a milestone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentService {

    public static final String CORRELATION_METADATA_KEY = "internalIntentId";

    private final PaymentTransactionRepository repository;
    private final MilestoneStateMachine milestones;
    private final PspGatewayRegistry gateways;

    /**
     * Creates a provider intent for the milestone's amount and records the
     * transaction in CREATED status. Amount, currency and project are taken
     * from the milestone; when supplied they must agree with it.
     */
    @Transactional
    public IntentCreated createIntent(UUID payerId, UUID projectId, UUID milestoneId, Long amount,
                                      CurrencyCode currency, String provider) {
        Milestone milestone = milestones.getMilestone(milestoneId);
        if (projectId != null && !projectId.equals(milestone.getProjectId())) {
            throw new NotFoundException(ErrorCode.MILESTONE_NOT_FOUND,
                    "Milestone " + milestoneId + " does not belong to project " + projectId);
        }
        if (milestone.getStatus() != MilestoneStatus.PENDING) {
            throw new ConflictException(ErrorCode.INVALID_TRANSITION,
                    "Milestone " + milestoneId + " is " + milestone.getStatus() + "; only PENDING milestones accept funding");
        }
        if (amount != null && amount != milestone.getAmount()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    "Amount " + amount + " does not match milestone amount " + milestone.getAmount());
        }
        if (currency != null && currency != milestone.getCurrency()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    "Currency " + currency + " does not match milestone currency " + milestone.getCurrency());
        }

        PspGateway gateway = provider != null ? gateways.get(provider) : gateways.getDefault();
        PaymentTransaction transaction = PaymentTransaction.create(payerId, milestone.getProjectId(), milestoneId,
                milestone.getAmount(), milestone.getCurrency(), gateway.providerName());

        IntentResult intent = gateway.createIntent(new IntentRequest(
                transaction.getAmount(),
                transaction.getCurrency(),
                transaction.getId().toString(),
                Map.of(CORRELATION_METADATA_KEY, transaction.getId().toString(),
                        "milestoneId", milestoneId.toString())));

        PaymentTransaction created = transaction.withProviderIntent(intent.getProviderIntentId());
        repository.save(PaymentTransactionEntity.fromDomain(created));

        log.info("Payment intent created: transactionId={}, milestoneId={}, provider={}, intentId={}, amount={} {}",
                created.getId(), milestoneId, created.getProvider(), intent.getProviderIntentId(),
                created.getAmount(), created.getCurrency());
        return new IntentCreated(created, intent);
    }

    @Transactional(readOnly = true)
    public PaymentTransaction getTransaction(UUID transactionId) {
        return repository.findById(transactionId)
                .map(PaymentTransactionEntity::toDomain)
                .orElseThrow(() -> new NotFoundException(ErrorCode.TRANSACTION_NOT_FOUND,
                        "Transaction not found: " + transactionId));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransaction> transactionsForMilestone(UUID milestoneId) {
        return repository.findByMilestoneIdOrderByCreatedAtAsc(milestoneId)
                .stream()
                .map(PaymentTransactionEntity::toDomain)
                .toList();
    }

    /**
     * A stored transaction together with the provider handle for the payer's client.
     */
    @Value
    public static class IntentCreated {
        PaymentTransaction transaction;
        IntentResult intent;
    }
}
