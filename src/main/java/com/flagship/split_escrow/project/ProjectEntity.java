package com.flagship.split_escrow.project;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A project groups milestones and owns the revenue-split agreement.
 *
 * Members are stored as normalized child rows so that membership changes are
 * ordinary inserts/deletes inside a transaction.
 */
@Entity
@Table(name = "projects")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProjectEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "project_members", joinColumns = @JoinColumn(name = "project_id"))
    @Column(name = "member_id", nullable = false)
    private Set<UUID> memberIds = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ProjectEntity create(String name, UUID ownerId, Set<UUID> memberIds) {
        ProjectEntity entity = new ProjectEntity();
        entity.id = UUID.randomUUID();
        entity.name = name;
        entity.ownerId = ownerId;
        if (memberIds != null) {
            entity.memberIds.addAll(memberIds);
        }
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void addMember(UUID memberId) {
        memberIds.add(memberId);
    }

    public boolean isOwner(UUID actorId) {
        return ownerId.equals(actorId);
    }

    /**
     * The owner is always treated as a member.
     */
    public boolean isMember(UUID actorId) {
        return isOwner(actorId) || memberIds.contains(actorId);
    }
}
