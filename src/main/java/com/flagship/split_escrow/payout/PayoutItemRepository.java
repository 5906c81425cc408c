package com.flagship.split_escrow.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutItemRepository extends JpaRepository<PayoutItemEntity, UUID> {

    @Query("SELECT i.batch.id FROM PayoutItemEntity i WHERE i.id = :itemId")
    Optional<UUID> findBatchIdByItemId(@Param("itemId") UUID itemId);

    @Query("SELECT i.batch.id FROM PayoutItemEntity i WHERE i.providerTransferId = :transferId")
    Optional<UUID> findBatchIdByProviderTransferId(@Param("transferId") String transferId);
}
