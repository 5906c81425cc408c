package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.escrow.EscrowRefundHandler;
import com.flagship.split_escrow.escrow.EscrowStatus;
import com.flagship.split_escrow.event.MilestoneTransitionedEvent;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.observability.CorrelationContext;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.payout.PayoutBatch;
import com.flagship.split_escrow.payout.PayoutScheduler;
import com.flagship.split_escrow.port.EventPublisherPort;
import com.flagship.split_escrow.port.JobQueuePort;
import com.flagship.split_escrow.project.ProjectAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Governs milestone status transitions and drives the escrow ledger.
 *
 * Every transition runs in one transaction that starts by taking a write lock
 * on the milestone row, then verifies legality, then writes. A rejected
 * transition throws before anything is written, so the milestone is never
 * left half-updated.
 *
 * Error classification:
 * - repeating a transition that already happened, or acting on a terminal
 *   milestone, fails ALREADY_PROCESSED
 * - a transition that is not legal from the current status fails INVALID_TRANSITION
 * - funding a milestone that already has an active escrow fails ESCROW_ALREADY_ACTIVE
 * - approving without an active escrow fails NOT_FUNDED
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MilestoneStateMachine {

    private static final EnumSet<MilestoneStatus> COMPLETED_OR_LATER =
            EnumSet.of(MilestoneStatus.COMPLETED, MilestoneStatus.APPROVED);
    private static final EnumSet<MilestoneStatus> DISPUTE_CLOSED =
            EnumSet.of(MilestoneStatus.APPROVED, MilestoneStatus.DISPUTED, MilestoneStatus.REJECTED);

    private final MilestoneRepository repository;
    private final EscrowLedger escrowLedger;
    private final PayoutScheduler payoutScheduler;
    private final ProjectAccess projectAccess;
    private final JobQueuePort jobQueue;
    private final EventPublisherPort eventPublisher;
    private final SettlementMetrics metrics;

    @Transactional
    public Milestone createMilestone(UUID projectId, UUID actorId, String title, long amount, CurrencyCode currency) {
        projectAccess.requireOwner(projectId, actorId);

        Milestone milestone = Milestone.create(projectId, title, amount, currency);
        repository.save(MilestoneEntity.fromDomain(milestone));

        log.info("Milestone created: milestoneId={}, projectId={}, amount={} {}",
                milestone.getId(), projectId, amount, currency);
        return milestone;
    }

    /**
     * Locks an escrow for the milestone and moves it to FUNDED.
     * Called once the funding payment is confirmed.
     */
    @Transactional
    public Milestone fund(UUID milestoneId, FundingSource source) {
        return withMilestoneContext(milestoneId, () -> {
            MilestoneEntity entity = lockMilestone(milestoneId);
            Milestone current = entity.toDomain();

            Optional<Escrow> active = escrowLedger.findActive(milestoneId);
            if (active.isPresent()) {
                throw new ConflictException(ErrorCode.ESCROW_ALREADY_ACTIVE,
                        "Milestone " + milestoneId + " is already funded by escrow " + active.get().getId());
            }
            if (current.getStatus() != MilestoneStatus.PENDING) {
                throw new ConflictException(ErrorCode.INVALID_TRANSITION,
                        "Milestone " + milestoneId + " is " + current.getStatus() + "; only PENDING milestones can be funded");
            }

            Escrow escrow = escrowLedger.lock(milestoneId, current.getProjectId(), source.getTransactionId(),
                    source.getAmount(), source.getCurrency(), source.getProvider(), source.getProviderReference());

            return apply(entity, current, current.fund(escrow.getId()), null, null);
        });
    }

    /**
     * Marks work as delivered. Any project member may complete.
     */
    @Transactional
    public Milestone complete(UUID milestoneId, UUID actorId) {
        return withMilestoneContext(milestoneId, () -> {
            MilestoneEntity entity = lockMilestone(milestoneId);
            Milestone current = entity.toDomain();
            projectAccess.requireMember(current.getProjectId(), actorId);

            if (COMPLETED_OR_LATER.contains(current.getStatus())) {
                throw new ConflictException(ErrorCode.ALREADY_PROCESSED,
                        "Milestone " + milestoneId + " is already " + current.getStatus());
            }
            if (current.getStatus() != MilestoneStatus.PENDING && current.getStatus() != MilestoneStatus.FUNDED) {
                throw invalidTransition(current, MilestoneStatus.COMPLETED);
            }

            return apply(entity, current, current.complete(), actorId, null);
        });
    }

    /**
     * Owner approval. Releases the escrow and schedules the payout batch in
     * the same transaction: either both happen or neither does.
     */
    @Transactional
    public ApprovalResult approve(UUID milestoneId, UUID actorId) {
        return withMilestoneContext(milestoneId, () -> {
            MilestoneEntity entity = lockMilestone(milestoneId);
            Milestone current = entity.toDomain();
            projectAccess.requireOwner(current.getProjectId(), actorId);

            if (current.getStatus().isTerminal()) {
                throw new ConflictException(ErrorCode.ALREADY_PROCESSED,
                        "Milestone " + milestoneId + " is already " + current.getStatus());
            }
            if (current.getStatus() != MilestoneStatus.COMPLETED && current.getStatus() != MilestoneStatus.DISPUTED) {
                throw invalidTransition(current, MilestoneStatus.APPROVED);
            }

            Escrow escrow = escrowLedger.findActive(milestoneId)
                    .orElseThrow(() -> new ConflictException(ErrorCode.NOT_FUNDED,
                            "Milestone " + milestoneId + " has no active escrow to release"));

            if (escrow.getStatus() == EscrowStatus.HELD) {
                escrow = escrowLedger.resume(escrow.getId());
            }
            Escrow released = escrowLedger.release(escrow.getId());
            Milestone approved = apply(entity, current, current.approve(), actorId, null);

            PayoutBatch batch = payoutScheduler.schedulePayouts(released.getId(), approved.getProjectId(),
                    approved.getId(), released.getAmount(), released.getCurrency());

            return new ApprovalResult(approved, released, batch);
        });
    }

    /**
     * Freezes the milestone. An active LOCKED escrow moves to HELD; a payout
     * job that was already enqueued is not cancelled here but re-checks the
     * escrow before moving funds.
     */
    @Transactional
    public Milestone dispute(UUID milestoneId, UUID actorId, String reason) {
        return withMilestoneContext(milestoneId, () -> {
            MilestoneEntity entity = lockMilestone(milestoneId);
            Milestone current = entity.toDomain();
            projectAccess.requireMember(current.getProjectId(), actorId);

            if (DISPUTE_CLOSED.contains(current.getStatus())) {
                throw new ConflictException(ErrorCode.ALREADY_PROCESSED,
                        "Milestone " + milestoneId + " is already " + current.getStatus());
            }

            escrowLedger.findActive(milestoneId)
                    .filter(escrow -> escrow.getStatus() == EscrowStatus.LOCKED)
                    .ifPresent(escrow -> escrowLedger.hold(escrow.getId()));

            return apply(entity, current, current.dispute(reason), actorId, reason);
        });
    }

    /**
     * Owner rejects a disputed milestone. The held escrow is refunded and the
     * provider refund is handed to the job runner.
     */
    @Transactional
    public Milestone reject(UUID milestoneId, UUID actorId, String reason) {
        return withMilestoneContext(milestoneId, () -> {
            MilestoneEntity entity = lockMilestone(milestoneId);
            Milestone current = entity.toDomain();
            projectAccess.requireOwner(current.getProjectId(), actorId);

            if (current.getStatus().isTerminal()) {
                throw new ConflictException(ErrorCode.ALREADY_PROCESSED,
                        "Milestone " + milestoneId + " is already " + current.getStatus());
            }
            if (current.getStatus() != MilestoneStatus.DISPUTED) {
                throw invalidTransition(current, MilestoneStatus.REJECTED);
            }

            escrowLedger.findActive(milestoneId).ifPresent(escrow -> {
                Escrow refunded = escrowLedger.refund(escrow.getId());
                jobQueue.enqueue(EscrowRefundHandler.JOB_TYPE, Map.of("escrowId", refunded.getId().toString()));
            });

            return apply(entity, current, current.reject(), actorId, reason);
        });
    }

    @Transactional(readOnly = true)
    public Milestone getMilestone(UUID milestoneId) {
        return repository.findById(milestoneId)
                .map(MilestoneEntity::toDomain)
                .orElseThrow(() -> notFound(milestoneId));
    }

    @Transactional(readOnly = true)
    public List<Milestone> getMilestones(UUID projectId) {
        return repository.findByProjectIdOrderByCreatedAtAsc(projectId)
                .stream()
                .map(MilestoneEntity::toDomain)
                .toList();
    }

    /**
     * True while the milestone still waits for its funding escrow.
     */
    @Transactional(readOnly = true)
    public boolean isAwaitingFunding(UUID milestoneId) {
        return repository.findById(milestoneId)
                .map(entity -> entity.getStatus() == MilestoneStatus.PENDING)
                .orElse(false);
    }

    private Milestone apply(MilestoneEntity entity, Milestone current, Milestone updated,
                            UUID actorId, String reason) {
        entity.updateFromDomain(updated);
        repository.saveAndFlush(entity);

        log.info("Milestone transitioned: milestoneId={}, {} -> {}, actor={}",
                updated.getId(), current.getStatus(), updated.getStatus(), actorId);
        metrics.recordMilestoneTransition(current.getStatus().name(), updated.getStatus().name());
        eventPublisher.publish(MilestoneTransitionedEvent.of(updated.getId(), updated.getProjectId(),
                current.getStatus().name(), updated.getStatus().name(), actorId, reason));
        return updated;
    }

    private MilestoneEntity lockMilestone(UUID milestoneId) {
        return repository.findByIdForUpdate(milestoneId).orElseThrow(() -> notFound(milestoneId));
    }

    private static NotFoundException notFound(UUID milestoneId) {
        return new NotFoundException(ErrorCode.MILESTONE_NOT_FOUND, "Milestone not found: " + milestoneId);
    }

    private static ConflictException invalidTransition(Milestone milestone, MilestoneStatus target) {
        return new ConflictException(ErrorCode.INVALID_TRANSITION,
                String.format("Cannot move milestone %s from %s to %s", milestone.getId(), milestone.getStatus(), target));
    }

    private <T> T withMilestoneContext(UUID milestoneId, Supplier<T> operation) {
        MDC.put(CorrelationContext.MILESTONE_ID_MDC_KEY, milestoneId.toString());
        try {
            return operation.get();
        } finally {
            MDC.remove(CorrelationContext.MILESTONE_ID_MDC_KEY);
        }
    }
}
