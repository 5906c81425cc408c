package com.flagship.split_escrow.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider callbacks. The body is taken raw so the signature is checked
 * against exactly what the provider sent.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WebhookReconciler reconciler;

    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, String>> receive(
            @PathVariable String provider,
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        WebhookOutcome outcome = reconciler.receive(provider, rawBody, signature);
        return ResponseEntity.ok(Map.of("result", outcome.name()));
    }
}
