package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.escrow.EscrowStatus;
import com.flagship.split_escrow.event.PayoutItemSettledEvent;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.payment.psp.TransferResult;
import com.flagship.split_escrow.port.EventPublisherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Item-level state changes of payout batches.
 *
 * Every write locks the batch row first, so the execution handler and
 * transfer webhooks never interleave on the same batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutBatchService {

    private final PayoutBatchRepository batchRepository;
    private final PayoutItemRepository itemRepository;
    private final EscrowLedger escrowLedger;
    private final EventPublisherPort eventPublisher;
    private final SettlementMetrics metrics;

    @Transactional(readOnly = true)
    public PayoutBatch getBatch(UUID batchId) {
        return batchRepository.findById(batchId)
                .map(PayoutBatchEntity::toDomain)
                .orElseThrow(() -> batchNotFound(batchId));
    }

    @Transactional(readOnly = true)
    public PayoutBatch getByEscrow(UUID escrowId) {
        return batchRepository.findByEscrowId(escrowId)
                .map(PayoutBatchEntity::toDomain)
                .orElseThrow(() -> new NotFoundException(ErrorCode.BATCH_NOT_FOUND,
                        "No payout batch for escrow " + escrowId));
    }

    /**
     * Claims one item for a transfer attempt after re-checking the escrow.
     * If the escrow is no longer RELEASED, every unpaid item is failed and the
     * batch is marked FAILED.
     */
    @Transactional
    public TransferClaim claimItem(UUID batchId, UUID itemId) {
        PayoutBatchEntity entity = lockBatch(batchId);
        PayoutBatch batch = entity.toDomain();

        Escrow escrow = escrowLedger.getEscrow(batch.getEscrowId());
        if (escrow.getStatus() != EscrowStatus.RELEASED) {
            String reason = "Escrow " + escrow.getId() + " is " + escrow.getStatus() + "; payout aborted";
            abort(entity, batch, reason);
            return TransferClaim.aborted(reason);
        }

        PayoutItem item = findItem(batch, itemId);
        if (!item.needsTransfer()) {
            return TransferClaim.skipped(item);
        }

        PayoutItem claimed = item.startAttempt();
        save(entity, batch, replaceItem(batch, claimed));
        log.debug("Payout item claimed: batchId={}, itemId={}, attempt={}", batchId, itemId, claimed.getAttempts());
        return TransferClaim.claimed(claimed);
    }

    /**
     * Applies the provider's answer to a transfer attempt.
     */
    @Transactional
    public PayoutBatch recordTransferResult(UUID batchId, UUID itemId, TransferResult result) {
        PayoutBatchEntity entity = lockBatch(batchId);
        PayoutBatch batch = entity.toDomain();
        PayoutItem item = findItem(batch, itemId);

        PayoutItem updated = switch (result.getStatus()) {
            case SUCCEEDED -> item.markPaid(result.getProviderTransferId());
            case PENDING -> item.markAwaitingConfirmation(result.getProviderTransferId());
            case FAILED -> item.markFailed(result.getFailureReason());
        };

        PayoutBatch saved = save(entity, batch, replaceItem(batch, updated));
        settled(saved, updated);
        return saved;
    }

    /**
     * Settles an item that is waiting for transfer confirmation.
     *
     * @return the updated batch, or empty if the item was not waiting
     *         (duplicate or stale delivery)
     */
    @Transactional
    public Optional<PayoutBatch> applyTransferWebhook(UUID itemId, String providerTransferId, boolean succeeded, String failureReason) {
        UUID batchId = (itemId != null
                ? itemRepository.findBatchIdByItemId(itemId)
                : itemRepository.findBatchIdByProviderTransferId(providerTransferId))
                .orElseThrow(() -> new NotFoundException(ErrorCode.BATCH_NOT_FOUND,
                        "No payout item for " + (itemId != null ? itemId : providerTransferId)));

        PayoutBatchEntity entity = lockBatch(batchId);
        PayoutBatch batch = entity.toDomain();
        PayoutItem item = itemId != null
                ? findItem(batch, itemId)
                : batch.getItems().stream()
                    .filter(candidate -> providerTransferId.equals(candidate.getProviderTransferId()))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException(ErrorCode.BATCH_NOT_FOUND,
                            "No payout item for transfer " + providerTransferId));

        if (item.getStatus() != PayoutStatus.PROCESSING) {
            log.info("Transfer webhook ignored: itemId={} is already {}", item.getId(), item.getStatus());
            return Optional.empty();
        }

        PayoutItem updated = succeeded
                ? item.markPaid(providerTransferId)
                : item.markFailed(failureReason != null ? failureReason : "Transfer failed at provider");
        PayoutBatch saved = save(entity, batch, replaceItem(batch, updated));
        settled(saved, updated);
        return Optional.of(saved);
    }

    /**
     * Marks the batch FAILED after its job gave up. Item statuses are kept.
     */
    @Transactional
    public PayoutBatch markFailed(UUID batchId, String reason) {
        PayoutBatchEntity entity = lockBatch(batchId);
        PayoutBatch batch = entity.toDomain();
        if (batch.allItemsPaid()) {
            return batch;
        }
        PayoutBatch failed = batch.toBuilder().status(PayoutStatus.FAILED).build();
        entity.updateFromDomain(failed);
        batchRepository.save(entity);
        log.error("Payout batch failed: batchId={}, escrowId={}, reason={}", batchId, batch.getEscrowId(), reason);
        return failed;
    }

    private void abort(PayoutBatchEntity entity, PayoutBatch batch, String reason) {
        List<PayoutItem> failedItems = new ArrayList<>();
        List<PayoutItem> items = batch.getItems().stream()
                .map(item -> {
                    if (item.isPaid()) {
                        return item;
                    }
                    PayoutItem failed = item.markFailed(reason);
                    failedItems.add(failed);
                    return failed;
                })
                .toList();
        PayoutBatch aborted = batch.toBuilder().items(items).status(PayoutStatus.FAILED).build();
        entity.updateFromDomain(aborted);
        batchRepository.save(entity);

        log.warn("Payout batch aborted: batchId={}, failedItems={}, reason={}", batch.getId(), failedItems.size(), reason);
        failedItems.forEach(item -> settled(aborted, item));
    }

    private PayoutBatch save(PayoutBatchEntity entity, PayoutBatch batch, PayoutBatch withItems) {
        PayoutBatch updated = withItems.toBuilder().status(withItems.derivedStatus()).build();
        entity.updateFromDomain(updated);
        batchRepository.save(entity);
        if (updated.getStatus() != batch.getStatus()) {
            log.info("Payout batch status: batchId={}, {} -> {}", batch.getId(), batch.getStatus(), updated.getStatus());
        }
        return updated;
    }

    private void settled(PayoutBatch batch, PayoutItem item) {
        if (item.getStatus() != PayoutStatus.PAID && item.getStatus() != PayoutStatus.FAILED) {
            return;
        }
        metrics.recordPayoutItemOutcome(item.getStatus().name());
        eventPublisher.publish(PayoutItemSettledEvent.of(item.getId(), batch.getId(), item.getRecipientId(),
                item.getNetAmount(), batch.getCurrency().name(), item.getStatus().name(), item.getFailureReason()));
    }

    private static PayoutBatch replaceItem(PayoutBatch batch, PayoutItem updated) {
        return batch.toBuilder()
                .items(batch.getItems().stream()
                        .map(item -> item.getId().equals(updated.getId()) ? updated : item)
                        .toList())
                .build();
    }

    private static PayoutItem findItem(PayoutBatch batch, UUID itemId) {
        return batch.getItems().stream()
                .filter(item -> item.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(ErrorCode.BATCH_NOT_FOUND,
                        "Payout item " + itemId + " not found in batch " + batch.getId()));
    }

    private PayoutBatchEntity lockBatch(UUID batchId) {
        return batchRepository.findByIdForUpdate(batchId).orElseThrow(() -> batchNotFound(batchId));
    }

    private static NotFoundException batchNotFound(UUID batchId) {
        return new NotFoundException(ErrorCode.BATCH_NOT_FOUND, "Payout batch not found: " + batchId);
    }
}
