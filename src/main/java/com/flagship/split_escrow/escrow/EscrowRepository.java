package com.flagship.split_escrow.escrow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowRepository extends JpaRepository<EscrowEntity, UUID> {

    List<EscrowEntity> findByMilestoneIdAndStatusIn(UUID milestoneId, Collection<EscrowStatus> statuses);

    Optional<EscrowEntity> findByTransactionId(UUID transactionId);

    boolean existsByTransactionId(UUID transactionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EscrowEntity e WHERE e.id = :id")
    Optional<EscrowEntity> findByIdForUpdate(@Param("id") UUID id);
}
