package com.flagship.split_escrow.split;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RevenueSplitRepository extends JpaRepository<RevenueSplitEntity, UUID> {

    List<RevenueSplitEntity> findByProjectIdAndActiveTrueOrderByPositionAsc(UUID projectId);
}
