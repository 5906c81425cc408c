package com.flagship.split_escrow.escrow;

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

/**
 * JPA entity for escrows.
 *
 * The one-active-escrow-per-milestone rule is also enforced in PostgreSQL by
 * a partial unique index (see V1 migration). {@code transaction_id} is unique
 * so a payment can fund at most one escrow.
 */
@Entity
@Table(
    name = "escrows",
    indexes = @Index(name = "idx_escrows_milestone_status", columnList = "milestone_id, status")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "milestone_id", nullable = false, updatable = false)
    private UUID milestoneId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true)
    private UUID transactionId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false, length = 50)
    private String provider;

    @Column(name = "provider_reference", updatable = false)
    private String providerReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowStatus status;

    @Column(name = "refund_reference")
    private String refundReference;

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

    static EscrowEntity fromDomain(Escrow escrow) {
        return new EscrowEntity(
            escrow.getId(),
            escrow.getMilestoneId(),
            escrow.getProjectId(),
            escrow.getTransactionId(),
            escrow.getAmount(),
            escrow.getCurrency(),
            escrow.getProvider(),
            escrow.getProviderReference(),
            escrow.getStatus(),
            escrow.getRefundReference(),
            null,
            null,
            null
        );
    }

    public Escrow toDomain() {
        return new Escrow(id, milestoneId, projectId, transactionId, amount, currency, provider,
                providerReference, status, refundReference, createdAt, updatedAt);
    }

    /**
     * Only status and refund reference are mutable.
     */
    void updateFromDomain(Escrow escrow) {
        this.status = escrow.getStatus();
        this.refundReference = escrow.getRefundReference();
    }
}
