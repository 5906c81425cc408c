package com.flagship.split_escrow.split;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.project.ProjectAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Owns a project's active revenue-split set and exposes split calculation
 * against either explicit splits or the stored agreement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevenueSplitService {

    private final RevenueSplitRepository repository;
    private final SplitCalculator calculator;
    private final ProjectAccess projectAccess;
    private final SettlementMetrics metrics;

    /**
     * Replaces the project's active split set. Percentages are validated
     * before anything is written.
     */
    @Transactional
    public List<RevenueSplit> replaceSplits(UUID projectId, UUID actorId, List<RevenueSplit> splits) {
        projectAccess.requireOwner(projectId, actorId);
        calculator.validatePercentages(splits);

        List<RevenueSplitEntity> current = repository.findByProjectIdAndActiveTrueOrderByPositionAsc(projectId);
        current.forEach(RevenueSplitEntity::deactivate);

        for (int i = 0; i < splits.size(); i++) {
            repository.save(RevenueSplitEntity.fromDomain(projectId, i, splits.get(i)));
        }

        log.info("Replaced revenue splits: projectId={}, previous={}, current={}",
                projectId, current.size(), splits.size());
        return List.copyOf(splits);
    }

    @Transactional(readOnly = true)
    public List<RevenueSplit> activeSplits(UUID projectId) {
        return repository.findByProjectIdAndActiveTrueOrderByPositionAsc(projectId)
                .stream()
                .map(RevenueSplitEntity::toDomain)
                .toList();
    }

    /**
     * Active splits of the project, failing when none are configured.
     */
    @Transactional(readOnly = true)
    public List<RevenueSplit> requireActiveSplits(UUID projectId) {
        List<RevenueSplit> splits = activeSplits(projectId);
        if (splits.isEmpty()) {
            throw new NotFoundException(ErrorCode.REVENUE_MODEL_NOT_FOUND,
                    "No active revenue splits configured for project " + projectId);
        }
        return splits;
    }

    /**
     * Calculates a breakdown from explicit splits when given, otherwise from
     * the project's stored agreement.
     */
    @Transactional(readOnly = true)
    public SplitBreakdown calculateSplit(long amount, CurrencyCode currency,
                                         UUID projectId, List<RevenueSplit> explicitSplits) {
        List<RevenueSplit> splits;
        if (explicitSplits != null && !explicitSplits.isEmpty()) {
            splits = explicitSplits;
        } else if (projectId != null) {
            splits = requireActiveSplits(projectId);
        } else {
            throw new IllegalArgumentException("Either splits or projectId must be provided");
        }

        SplitBreakdown breakdown = calculator.calculate(amount, currency, splits);
        metrics.recordSplitCalculated(currency.name(), breakdown.getShares().size());
        return breakdown;
    }
}
