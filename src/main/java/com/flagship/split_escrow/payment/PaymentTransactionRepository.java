package com.flagship.split_escrow.payment;

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
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PaymentTransactionEntity t WHERE t.id = :id")
    Optional<PaymentTransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    List<PaymentTransactionEntity> findByMilestoneIdOrderByCreatedAtAsc(UUID milestoneId);
}
