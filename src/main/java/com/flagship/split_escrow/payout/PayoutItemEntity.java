package com.flagship.split_escrow.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Items are only written while the owning batch row is locked.
 */
@Entity
@Table(
    name = "payout_items",
    indexes = {
        @Index(name = "idx_payout_items_batch", columnList = "batch_id"),
        @Index(name = "idx_payout_items_transfer", columnList = "provider_transfer_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "batch_id", nullable = false, updatable = false)
    private PayoutBatchEntity batch;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private UUID recipientId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 10)
    private BigDecimal percentage;

    @Column(name = "gross_share", nullable = false, updatable = false)
    private long grossShare;

    @Column(name = "platform_fee_share", nullable = false, updatable = false)
    private long platformFeeShare;

    @Column(name = "tax_withheld", nullable = false, updatable = false)
    private long taxWithheld;

    @Column(name = "net_amount", nullable = false, updatable = false)
    private long netAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "provider_transfer_id", length = 255)
    private String providerTransferId;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "paid_at")
    private Instant paidAt;

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

    static PayoutItemEntity fromDomain(PayoutBatchEntity batch, PayoutItem item) {
        PayoutItemEntity entity = new PayoutItemEntity();
        entity.id = item.getId();
        entity.batch = batch;
        entity.position = item.getPosition();
        entity.recipientId = item.getRecipientId();
        entity.percentage = item.getPercentage();
        entity.grossShare = item.getGrossShare();
        entity.platformFeeShare = item.getPlatformFeeShare();
        entity.taxWithheld = item.getTaxWithheld();
        entity.netAmount = item.getNetAmount();
        entity.updateFromDomain(item);
        return entity;
    }

    PayoutItem toDomain() {
        return PayoutItem.builder()
                .id(id)
                .position(position)
                .recipientId(recipientId)
                .percentage(percentage)
                .grossShare(grossShare)
                .platformFeeShare(platformFeeShare)
                .taxWithheld(taxWithheld)
                .netAmount(netAmount)
                .status(status)
                .attempts(attempts)
                .providerTransferId(providerTransferId)
                .failureReason(failureReason)
                .paidAt(paidAt)
                .updatedAt(updatedAt)
                .build();
    }

    void updateFromDomain(PayoutItem item) {
        this.status = item.getStatus();
        this.attempts = item.getAttempts();
        this.providerTransferId = item.getProviderTransferId();
        this.failureReason = truncate(item.getFailureReason());
        this.paidAt = item.getPaidAt();
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }
}
