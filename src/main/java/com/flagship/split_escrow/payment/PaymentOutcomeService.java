package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Applies a provider-confirmed payment outcome to its transaction.
 *
 * Runs in its own transaction under a row lock, so concurrent deliveries of
 * the same event serialize and only the first one changes the status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentOutcomeService {

    private final PaymentTransactionRepository repository;

    /**
     * @param providerObjectId the provider's intent id from the event, must match the stored one
     * @return the transaction after the call, flagged as duplicate if it was already terminal
     */
    @Transactional
    public RecordedOutcome recordOutcome(String provider, UUID transactionId, String providerObjectId,
                                         boolean succeeded, String failureReason) {
        PaymentTransactionEntity entity = repository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.TRANSACTION_NOT_FOUND,
                        "Transaction not found for correlation id " + transactionId));
        PaymentTransaction current = entity.toDomain();

        if (!provider.equals(current.getProvider())
                || providerObjectId == null
                || !providerObjectId.equals(current.getProviderIntentId())) {
            throw new ValidationException(ErrorCode.PROVIDER_REFERENCE_MISMATCH,
                    String.format("Webhook object %s from %s does not match transaction %s (%s %s)",
                            providerObjectId, provider, transactionId,
                            current.getProvider(), current.getProviderIntentId()));
        }

        if (current.isTerminal()) {
            return new RecordedOutcome(current, true);
        }

        PaymentTransaction updated = succeeded ? current.markSucceeded() : current.markFailed(failureReason);
        entity.updateFromDomain(updated);
        repository.save(entity);

        log.info("Transaction reconciled: transactionId={}, {} -> {}",
                transactionId, current.getStatus(), updated.getStatus());
        return new RecordedOutcome(updated, false);
    }

    @Value
    public static class RecordedOutcome {
        PaymentTransaction transaction;
        boolean duplicate;
    }
}
