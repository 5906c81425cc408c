package com.flagship.split_escrow.payout;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutBatchRepository extends JpaRepository<PayoutBatchEntity, UUID> {

    boolean existsByEscrowId(UUID escrowId);

    Optional<PayoutBatchEntity> findByEscrowId(UUID escrowId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM PayoutBatchEntity b WHERE b.id = :id")
    Optional<PayoutBatchEntity> findByIdForUpdate(@Param("id") UUID id);
}
