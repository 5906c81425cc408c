package com.flagship.split_escrow.split;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted revenue-split entry. Replaced sets are deactivated, never edited.
 */
@Entity
@Table(
    name = "revenue_splits",
    indexes = @Index(name = "idx_revenue_splits_project_active", columnList = "project_id, active")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RevenueSplitEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(name = "recipient_id", updatable = false)
    private UUID recipientId;

    @Column(name = "placeholder_label", updatable = false)
    private String placeholderLabel;

    @Column(precision = 7, scale = 4, updatable = false)
    private BigDecimal percentage;

    @Column(name = "fixed_amount", updatable = false)
    private Long fixedAmount;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static RevenueSplitEntity fromDomain(UUID projectId, int position, RevenueSplit split) {
        return new RevenueSplitEntity(
            UUID.randomUUID(),
            projectId,
            position,
            split.getRecipientId(),
            split.getPlaceholderLabel(),
            split.getPercentage(),
            split.getFixedAmount(),
            true,
            null
        );
    }

    public RevenueSplit toDomain() {
        return RevenueSplit.builder()
                .recipientId(recipientId)
                .placeholderLabel(placeholderLabel)
                .percentage(percentage)
                .fixedAmount(fixedAmount)
                .build();
    }

    void deactivate() {
        this.active = false;
    }
}
