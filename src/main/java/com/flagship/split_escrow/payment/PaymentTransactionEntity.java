package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.common.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "payment_transactions",
    indexes = {
        @Index(name = "idx_transactions_milestone", columnList = "milestone_id"),
        @Index(name = "idx_transactions_intent", columnList = "provider, provider_intent_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private UUID payerId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "milestone_id", nullable = false, updatable = false)
    private UUID milestoneId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false, length = 50)
    private String provider;

    @Column(name = "provider_intent_id", length = 255)
    private String providerIntentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentTransactionEntity fromDomain(PaymentTransaction transaction) {
        return new PaymentTransactionEntity(
            transaction.getId(),
            transaction.getPayerId(),
            transaction.getProjectId(),
            transaction.getMilestoneId(),
            transaction.getAmount(),
            transaction.getCurrency(),
            transaction.getProvider(),
            transaction.getProviderIntentId(),
            transaction.getStatus(),
            transaction.getFailureReason(),
            null,
            null,
            null
        );
    }

    public PaymentTransaction toDomain() {
        return new PaymentTransaction(id, payerId, projectId, milestoneId, amount, currency, provider,
                providerIntentId, status, failureReason, createdAt, updatedAt);
    }

    void updateFromDomain(PaymentTransaction transaction) {
        this.providerIntentId = transaction.getProviderIntentId();
        this.status = transaction.getStatus();
        this.failureReason = transaction.getFailureReason();
    }
}
