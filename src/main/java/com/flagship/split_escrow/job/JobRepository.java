package com.flagship.split_escrow.job;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<JobEntity, UUID> {

    /**
     * Due jobs of a type, highest priority first, then oldest due time.
     */
    @Query("""
        SELECT j.id FROM JobEntity j
        WHERE j.type = :type AND j.status = :status AND j.nextRunAt <= :now
        ORDER BY j.priority DESC, j.nextRunAt ASC
        """)
    List<UUID> findDueJobIds(@Param("type") String type,
                             @Param("status") JobStatus status,
                             @Param("now") Instant now,
                             Pageable page);

    /**
     * Conditional lease: succeeds (returns 1) only if the job is still QUEUED.
     * Two workers racing for the same job cannot both win.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE JobEntity j
        SET j.status = :leased, j.workerId = :workerId, j.leaseExpiresAt = :leaseExpiresAt,
            j.updatedAt = :now, j.version = j.version + 1
        WHERE j.id = :id AND j.status = :queued
        """)
    int tryLease(@Param("id") UUID id,
                 @Param("workerId") String workerId,
                 @Param("leaseExpiresAt") Instant leaseExpiresAt,
                 @Param("now") Instant now,
                 @Param("queued") JobStatus queued,
                 @Param("leased") JobStatus leased);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JobEntity j WHERE j.id = :id")
    Optional<JobEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT j.id FROM JobEntity j
        WHERE j.status = :status AND j.leaseExpiresAt < :now
        """)
    List<UUID> findExpiredLeaseIds(@Param("status") JobStatus status, @Param("now") Instant now);

    List<JobEntity> findByStatusOrderByUpdatedAtDesc(JobStatus status);

    List<JobEntity> findByTypeOrderByCreatedAtAsc(String type);

    long countByStatus(JobStatus status);
}
