package com.flagship.split_escrow.split;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.split.dto.CalculateSplitRequest;
import com.flagship.split_escrow.split.dto.SplitBreakdownResponse;
import com.flagship.split_escrow.split.dto.SplitEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/splits")
@RequiredArgsConstructor
@Slf4j
public class SplitController {

    private final RevenueSplitService splitService;

    @PostMapping("/calculate")
    public ResponseEntity<SplitBreakdownResponse> calculate(@Valid @RequestBody CalculateSplitRequest request) {
        List<RevenueSplit> splits = request.getSplits() == null
                ? List.of()
                : request.getSplits().stream().map(SplitEntryRequest::toDomain).toList();

        SplitBreakdown breakdown = splitService.calculateSplit(
                request.getAmount(),
                CurrencyCode.fromString(request.getCurrency()),
                request.getProjectId(),
                splits);

        log.info("Split calculated: amount={}, currency={}, recipients={}, fee={}",
                request.getAmount(), breakdown.getCurrency(), breakdown.getShares().size(), breakdown.getPlatformFee());

        return ResponseEntity.ok(SplitBreakdownResponse.from(breakdown));
    }
}
