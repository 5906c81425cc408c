package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.escrow.EscrowStatus;
import com.flagship.split_escrow.event.PayoutBatchScheduledEvent;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.observability.CorrelationContext;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.port.EventPublisherPort;
import com.flagship.split_escrow.port.JobQueuePort;
import com.flagship.split_escrow.split.RecipientShare;
import com.flagship.split_escrow.split.RevenueSplit;
import com.flagship.split_escrow.split.RevenueSplitService;
import com.flagship.split_escrow.split.SplitBreakdown;
import com.flagship.split_escrow.split.SplitCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a released escrow into a payout batch and hands it to the job runner.
 *
 * The escrow id is the idempotency key. Concurrent calls for the same escrow
 * serialize on the escrow row lock; the loser sees the committed batch and
 * fails ALREADY_SCHEDULED. The unique constraint on {@code escrow_id} backs
 * this up if the lock is ever bypassed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutScheduler {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int RENORMALIZED_SCALE = 10;

    private final PayoutBatchRepository batchRepository;
    private final EscrowLedger escrowLedger;
    private final RevenueSplitService revenueSplitService;
    private final SplitCalculator calculator;
    private final JobQueuePort jobQueue;
    private final EventPublisherPort eventPublisher;
    private final SettlementMetrics metrics;

    @Value("${payout.placeholder-policy:WITHHOLD}")
    private PlaceholderPolicy defaultPolicy;

    @Transactional
    public PayoutBatch schedulePayouts(UUID escrowId, UUID projectId, UUID milestoneId,
                                       long amount, CurrencyCode currency) {
        return schedulePayouts(escrowId, projectId, milestoneId, amount, currency, defaultPolicy);
    }

    @Transactional
    public PayoutBatch schedulePayouts(UUID escrowId, UUID projectId, UUID milestoneId,
                                       long amount, CurrencyCode currency, PlaceholderPolicy policy) {
        MDC.put(CorrelationContext.ESCROW_ID_MDC_KEY, escrowId.toString());
        try {
            Escrow escrow = escrowLedger.getEscrowForUpdate(escrowId);
            if (escrow.getStatus() != EscrowStatus.RELEASED) {
                throw new ConflictException(ErrorCode.INVALID_TRANSITION,
                        "Escrow " + escrowId + " is " + escrow.getStatus() + "; only RELEASED escrows can be paid out");
            }
            if (batchRepository.existsByEscrowId(escrowId)) {
                throw alreadyScheduled(escrowId, null);
            }
            requireMatchesEscrow(escrow, projectId, milestoneId, amount, currency);

            List<RevenueSplit> splits = revenueSplitService.requireActiveSplits(projectId);
            calculator.validatePercentages(splits);

            List<RevenueSplit> resolved = splits.stream()
                    .filter(split -> !split.isPlaceholder() && split.hasPercentage())
                    .toList();
            if (resolved.isEmpty()) {
                throw new ValidationException(ErrorCode.NO_RECIPIENTS,
                        "Project " + projectId + " has no resolvable payout recipients");
            }

            SplitBreakdown breakdown = policy == PlaceholderPolicy.RENORMALIZE
                    ? calculator.calculate(amount, currency, renormalize(resolved))
                    : calculator.calculate(amount, currency, splits);

            List<RecipientShare> payable = breakdown.getShares().stream()
                    .filter(share -> !share.isPlaceholder())
                    .toList();
            long totalNet = payable.stream().mapToLong(RecipientShare::getNetAmount).sum();
            long withheld = breakdown.getNetPool() - totalNet;
            if (policy == PlaceholderPolicy.RENORMALIZE && withheld != 0) {
                log.error("CRITICAL renormalized payout does not cover the net pool: escrowId={}, netPool={}, totalNet={}",
                        escrowId, breakdown.getNetPool(), totalNet);
                throw new IllegalStateException("Renormalized payout left " + withheld + " undistributed");
            }

            PayoutBatch batch = buildBatch(escrowId, projectId, escrow.getMilestoneId(), currency, breakdown,
                    payable, totalNet, withheld, policy);

            PayoutBatchEntity entity = PayoutBatchEntity.fromDomain(batch);
            try {
                batchRepository.saveAndFlush(entity);
            } catch (DataIntegrityViolationException e) {
                throw alreadyScheduled(escrowId, e);
            }

            UUID jobId = jobQueue.enqueue(PayoutExecutionHandler.JOB_TYPE, Map.of(
                    "batchId", batch.getId().toString(),
                    "escrowId", escrowId.toString()));
            PayoutBatch scheduled = batch.toBuilder().jobId(jobId).build();
            entity.updateFromDomain(scheduled);

            log.info("Payout batch scheduled: batchId={}, escrowId={}, items={}, totalNet={} {}, withheld={}, policy={}, jobId={}",
                    scheduled.getId(), escrowId, payable.size(), totalNet, currency, withheld, policy, jobId);
            metrics.recordPayoutBatchScheduled(currency.name(), policy.name());
            eventPublisher.publish(PayoutBatchScheduledEvent.of(scheduled.getId(), escrowId, projectId,
                    currency.name(), totalNet, withheld,
                    payable.stream().map(RecipientShare::getRecipientId).toList(), jobId));
            return scheduled;
        } finally {
            MDC.remove(CorrelationContext.ESCROW_ID_MDC_KEY);
        }
    }

    public PlaceholderPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * The payout terms must restate the escrow being paid out. The milestone
     * may be omitted, in which case the escrow's is used.
     */
    private static void requireMatchesEscrow(Escrow escrow, UUID projectId, UUID milestoneId,
                                             long amount, CurrencyCode currency) {
        List<String> mismatches = new ArrayList<>();
        if (!escrow.getProjectId().equals(projectId)) {
            mismatches.add("projectId " + projectId + " != " + escrow.getProjectId());
        }
        if (milestoneId != null && !escrow.getMilestoneId().equals(milestoneId)) {
            mismatches.add("milestoneId " + milestoneId + " != " + escrow.getMilestoneId());
        }
        if (escrow.getAmount() != amount) {
            mismatches.add("amount " + amount + " != " + escrow.getAmount());
        }
        if (escrow.getCurrency() != currency) {
            mismatches.add("currency " + currency + " != " + escrow.getCurrency());
        }
        if (!mismatches.isEmpty()) {
            throw new ValidationException(ErrorCode.ESCROW_MISMATCH,
                    "Payout terms do not match escrow " + escrow.getId() + ": " + String.join(", ", mismatches));
        }
    }

    private static List<RevenueSplit> renormalize(List<RevenueSplit> resolved) {
        BigDecimal total = resolved.stream()
                .map(RevenueSplit::getPercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            throw new ValidationException(ErrorCode.SPLIT_SUM_INVALID,
                    "Resolved recipients hold 0% of the split; nothing to renormalize");
        }
        return resolved.stream()
                .map(split -> split.withPercentage(split.getPercentage()
                        .multiply(HUNDRED)
                        .divide(total, RENORMALIZED_SCALE, RoundingMode.HALF_EVEN)))
                .toList();
    }

    private static PayoutBatch buildBatch(UUID escrowId, UUID projectId, UUID milestoneId, CurrencyCode currency,
                                          SplitBreakdown breakdown, List<RecipientShare> payable,
                                          long totalNet, long withheld, PlaceholderPolicy policy) {
        Instant now = Instant.now();
        List<PayoutItem> items = payable.stream()
                .map(share -> PayoutItem.builder()
                        .id(UUID.randomUUID())
                        .position(share.getPosition())
                        .recipientId(share.getRecipientId())
                        .percentage(share.getPercentage())
                        .grossShare(share.getGrossShare())
                        .platformFeeShare(share.getPlatformFeeShare())
                        .taxWithheld(share.getTaxWithheld())
                        .netAmount(share.getNetAmount())
                        .status(PayoutStatus.SCHEDULED)
                        .attempts(0)
                        .updatedAt(now)
                        .build())
                .toList();

        return PayoutBatch.builder()
                .id(UUID.randomUUID())
                .escrowId(escrowId)
                .projectId(projectId)
                .milestoneId(milestoneId)
                .currency(currency)
                .grossAmount(breakdown.getGrossAmount())
                .platformFee(breakdown.getPlatformFee())
                .netPool(breakdown.getNetPool())
                .totalNet(totalNet)
                .withheldAmount(withheld)
                .placeholderPolicy(policy)
                .status(PayoutStatus.SCHEDULED)
                .items(items)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static ConflictException alreadyScheduled(UUID escrowId, Throwable cause) {
        String message = "Payout batch already scheduled for escrow " + escrowId;
        return cause != null
                ? new ConflictException(ErrorCode.ALREADY_SCHEDULED, message, cause)
                : new ConflictException(ErrorCode.ALREADY_SCHEDULED, message);
    }
}
