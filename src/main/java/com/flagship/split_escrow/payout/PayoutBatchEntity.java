package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.common.CurrencyCode;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JPA entity for payout batches.
 *
 * {@code escrow_id} is unique: the database rejects a second batch for the
 * same escrow even if two schedulers pass the existence check together.
 */
@Entity
@Table(name = "payout_batches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutBatchEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "escrow_id", nullable = false, updatable = false, unique = true)
    private UUID escrowId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "milestone_id", updatable = false)
    private UUID milestoneId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private long grossAmount;

    @Column(name = "platform_fee", nullable = false, updatable = false)
    private long platformFee;

    @Column(name = "net_pool", nullable = false, updatable = false)
    private long netPool;

    @Column(name = "total_net", nullable = false, updatable = false)
    private long totalNet;

    @Column(name = "withheld_amount", nullable = false, updatable = false)
    private long withheldAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "placeholder_policy", nullable = false, length = 20, updatable = false)
    private PlaceholderPolicy placeholderPolicy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "job_id")
    private UUID jobId;

    @OneToMany(mappedBy = "batch", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("position ASC")
    private List<PayoutItemEntity> items = new ArrayList<>();

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

    static PayoutBatchEntity fromDomain(PayoutBatch batch) {
        PayoutBatchEntity entity = new PayoutBatchEntity();
        entity.id = batch.getId();
        entity.escrowId = batch.getEscrowId();
        entity.projectId = batch.getProjectId();
        entity.milestoneId = batch.getMilestoneId();
        entity.currency = batch.getCurrency();
        entity.grossAmount = batch.getGrossAmount();
        entity.platformFee = batch.getPlatformFee();
        entity.netPool = batch.getNetPool();
        entity.totalNet = batch.getTotalNet();
        entity.withheldAmount = batch.getWithheldAmount();
        entity.placeholderPolicy = batch.getPlaceholderPolicy();
        entity.status = batch.getStatus();
        entity.jobId = batch.getJobId();
        for (PayoutItem item : batch.getItems()) {
            entity.items.add(PayoutItemEntity.fromDomain(entity, item));
        }
        return entity;
    }

    public PayoutBatch toDomain() {
        return PayoutBatch.builder()
                .id(id)
                .escrowId(escrowId)
                .projectId(projectId)
                .milestoneId(milestoneId)
                .currency(currency)
                .grossAmount(grossAmount)
                .platformFee(platformFee)
                .netPool(netPool)
                .totalNet(totalNet)
                .withheldAmount(withheldAmount)
                .placeholderPolicy(placeholderPolicy)
                .status(status)
                .jobId(jobId)
                .items(items.stream().map(PayoutItemEntity::toDomain).toList())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Copies mutable batch and item state. Items are matched by id; the item
     * set itself never changes after creation.
     */
    void updateFromDomain(PayoutBatch batch) {
        this.status = batch.getStatus();
        this.jobId = batch.getJobId();
        Map<UUID, PayoutItem> byId = batch.getItems().stream()
                .collect(Collectors.toMap(PayoutItem::getId, Function.identity()));
        for (PayoutItemEntity item : items) {
            PayoutItem updated = byId.get(item.getId());
            if (updated != null) {
                item.updateFromDomain(updated);
            }
        }
    }
}
