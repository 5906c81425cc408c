package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.payment.dto.CreateIntentRequest;
import com.flagship.split_escrow.payment.dto.IntentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentIntentService intentService;

    /**
     * Starts funding a milestone. The returned transaction id is echoed back
     * by the provider in its webhooks.
     */
    @PostMapping("/intents")
    public ResponseEntity<IntentResponse> createIntent(@Valid @RequestBody CreateIntentRequest request) {
        log.info("Received intent request: payerId={}, milestoneId={}, provider={}",
                request.getPayerId(), request.getMilestoneId(), request.getProvider());

        PaymentIntentService.IntentCreated created = intentService.createIntent(
                request.getPayerId(),
                request.getProjectId(),
                request.getMilestoneId(),
                request.getAmount(),
                request.getCurrency() != null ? CurrencyCode.fromString(request.getCurrency()) : null,
                request.getProvider());

        return ResponseEntity.status(HttpStatus.CREATED).body(IntentResponse.from(created));
    }
}
