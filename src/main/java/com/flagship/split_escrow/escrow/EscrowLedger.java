package com.flagship.split_escrow.escrow;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.event.EscrowStatusChangedEvent;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.port.EventPublisherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Tracks the locked/held/released life of funds tied to a milestone.
 *
 * Every mutation loads the escrow row with a write lock, applies the domain
 * transition and writes it back, so concurrent callers serialize per escrow.
 * Callers are expected to hold the owning milestone's lock as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowLedger {

    private static final EnumSet<EscrowStatus> ACTIVE = EnumSet.of(EscrowStatus.LOCKED, EscrowStatus.HELD);

    private final EscrowRepository repository;
    private final EventPublisherPort eventPublisher;
    private final SettlementMetrics metrics;

    /**
     * Locks funds for a milestone.
     *
     * @throws ConflictException ESCROW_ALREADY_ACTIVE if the milestone already has a LOCKED or HELD escrow
     */
    @Transactional
    public Escrow lock(UUID milestoneId, UUID projectId, UUID transactionId, long amount,
                       CurrencyCode currency, String provider, String providerReference) {
        findActive(milestoneId).ifPresent(active -> {
            throw new ConflictException(ErrorCode.ESCROW_ALREADY_ACTIVE,
                    "Milestone " + milestoneId + " already has active escrow " + active.getId()
                            + " in " + active.getStatus() + " status");
        });

        Escrow escrow = Escrow.lock(milestoneId, projectId, transactionId, amount, currency, provider, providerReference);
        try {
            repository.saveAndFlush(EscrowEntity.fromDomain(escrow));
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(ErrorCode.ESCROW_ALREADY_ACTIVE,
                    "Escrow already exists for milestone " + milestoneId + " or transaction " + transactionId, e);
        }

        log.info("Escrow locked: escrowId={}, milestoneId={}, amount={} {}",
                escrow.getId(), milestoneId, amount, currency);
        recordTransition(escrow);
        return escrow;
    }

    @Transactional
    public Escrow hold(UUID escrowId) {
        return transition(escrowId, Escrow::hold);
    }

    /**
     * Returns a held escrow to LOCKED when a dispute is resolved without release.
     */
    @Transactional
    public Escrow resume(UUID escrowId) {
        return transition(escrowId, Escrow::resume);
    }

    /**
     * Moves a LOCKED escrow to RELEASED. This is the trigger for payout scheduling.
     */
    @Transactional
    public Escrow release(UUID escrowId) {
        return transition(escrowId, Escrow::release);
    }

    @Transactional
    public Escrow refund(UUID escrowId) {
        return transition(escrowId, Escrow::refund);
    }

    @Transactional
    public Escrow recordRefundReference(UUID escrowId, String refundReference) {
        EscrowEntity entity = lockEscrow(escrowId);
        Escrow updated = entity.toDomain().withRefundReference(refundReference);
        entity.updateFromDomain(updated);
        log.info("Escrow refund confirmed: escrowId={}, refundReference={}", escrowId, refundReference);
        return updated;
    }

    @Transactional(readOnly = true)
    public Optional<Escrow> findActive(UUID milestoneId) {
        List<EscrowEntity> active = repository.findByMilestoneIdAndStatusIn(milestoneId, ACTIVE);
        if (active.size() > 1) {
            log.error("Milestone {} has {} active escrows, expected at most one", milestoneId, active.size());
        }
        return active.stream().findFirst().map(EscrowEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Escrow getEscrow(UUID escrowId) {
        return repository.findById(escrowId)
                .map(EscrowEntity::toDomain)
                .orElseThrow(() -> new NotFoundException(ErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId));
    }

    /**
     * Reads the escrow under a write lock so the caller's decision holds until commit.
     */
    @Transactional
    public Escrow getEscrowForUpdate(UUID escrowId) {
        return lockEscrow(escrowId).toDomain();
    }

    @Transactional(readOnly = true)
    public boolean hasEscrowForTransaction(UUID transactionId) {
        return repository.existsByTransactionId(transactionId);
    }

    private Escrow transition(UUID escrowId, UnaryOperator<Escrow> operation) {
        EscrowEntity entity = lockEscrow(escrowId);
        Escrow current = entity.toDomain();
        Escrow updated = operation.apply(current);
        entity.updateFromDomain(updated);

        log.info("Escrow transitioned: escrowId={}, {} -> {}", escrowId, current.getStatus(), updated.getStatus());
        recordTransition(updated);
        return updated;
    }

    private EscrowEntity lockEscrow(UUID escrowId) {
        return repository.findByIdForUpdate(escrowId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId));
    }

    private void recordTransition(Escrow escrow) {
        metrics.recordEscrowTransition(escrow.getStatus().name());
        eventPublisher.publish(EscrowStatusChangedEvent.of(escrow.getId(), escrow.getMilestoneId(),
                escrow.getProjectId(), escrow.getAmount(), escrow.getCurrency().name(), escrow.getStatus().name()));
    }
}
