package com.flagship.split_escrow.milestone;

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
 * JPA entity for milestones.
 *
 * No setters: state only changes through {@link #updateFromDomain(Milestone)}
 * with a domain object that already validated the transition. The version
 * column turns any write that bypassed the row lock into an optimistic
 * locking failure.
 */
@Entity
@Table(
    name = "milestones",
    indexes = @Index(name = "idx_milestones_project", columnList = "project_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MilestoneEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MilestoneStatus status;

    @Column(name = "escrow_id")
    private UUID escrowId;

    @Column(name = "dispute_reason", columnDefinition = "TEXT")
    private String disputeReason;

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

    static MilestoneEntity fromDomain(Milestone milestone) {
        return new MilestoneEntity(
            milestone.getId(),
            milestone.getProjectId(),
            milestone.getTitle(),
            milestone.getAmount(),
            milestone.getCurrency(),
            milestone.getStatus(),
            milestone.getEscrowId(),
            milestone.getDisputeReason(),
            null,
            null,
            null
        );
    }

    public Milestone toDomain() {
        return new Milestone(id, projectId, title, amount, currency, status, escrowId,
                disputeReason, createdAt, updatedAt);
    }

    void updateFromDomain(Milestone milestone) {
        this.status = milestone.getStatus();
        this.escrowId = milestone.getEscrowId();
        this.disputeReason = milestone.getDisputeReason();
    }
}
