package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.payout.dto.PayoutBatchResponse;
import com.flagship.split_escrow.payout.dto.SchedulePayoutRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/payouts")
@RequiredArgsConstructor
@Slf4j
public class PayoutController {

    private final PayoutScheduler payoutScheduler;
    private final PayoutBatchService batchService;

    @PostMapping("/schedule")
    public ResponseEntity<PayoutBatchResponse> schedule(@Valid @RequestBody SchedulePayoutRequest request) {
        PlaceholderPolicy policy = request.getPlaceholderPolicy() == null
                ? payoutScheduler.getDefaultPolicy()
                : parsePolicy(request.getPlaceholderPolicy());

        PayoutBatch batch = payoutScheduler.schedulePayouts(
                request.getEscrowId(),
                request.getProjectId(),
                request.getMilestoneId(),
                request.getAmount(),
                CurrencyCode.fromString(request.getCurrency()),
                policy);

        return ResponseEntity.status(HttpStatus.CREATED).body(PayoutBatchResponse.from(batch));
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<PayoutBatchResponse> getBatch(@PathVariable UUID batchId) {
        return ResponseEntity.ok(PayoutBatchResponse.from(batchService.getBatch(batchId)));
    }

    @GetMapping("/batches/by-escrow/{escrowId}")
    public ResponseEntity<PayoutBatchResponse> getBatchByEscrow(@PathVariable UUID escrowId) {
        return ResponseEntity.ok(PayoutBatchResponse.from(batchService.getByEscrow(escrowId)));
    }

    private static PlaceholderPolicy parsePolicy(String value) {
        try {
            return PlaceholderPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown placeholder policy: " + value + ". Supported: WITHHOLD, RENORMALIZE");
        }
    }
}
