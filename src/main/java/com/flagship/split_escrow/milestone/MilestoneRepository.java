package com.flagship.split_escrow.milestone;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MilestoneRepository extends JpaRepository<MilestoneEntity, UUID> {

    /**
     * Loads a milestone with a row-level write lock. Every transition goes
     * through this so that two callers never mutate the same milestone at once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MilestoneEntity m WHERE m.id = :id")
    Optional<MilestoneEntity> findByIdForUpdate(@Param("id") UUID id);

    List<MilestoneEntity> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
}
