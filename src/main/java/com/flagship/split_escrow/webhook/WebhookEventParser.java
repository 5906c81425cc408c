package com.flagship.split_escrow.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.payment.PaymentIntentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads provider payloads of the form
 * {@code {"type": ..., "data": {"object": {"id": ..., "metadata": {...}}}}}.
 */
@Component
@RequiredArgsConstructor
public class WebhookEventParser {

    private final ObjectMapper objectMapper;

    public WebhookEvent parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "Webhook body is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.INVALID_WEBHOOK_PAYLOAD,
                    "Webhook body is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "Webhook body must be a JSON object");
        }

        String type = text(root.path("type"));
        JsonNode object = root.path("data").path("object");
        JsonNode metadata = object.path("metadata");

        String failureReason = text(object.path("failure_message"));
        if (failureReason == null) {
            failureReason = text(object.path("last_payment_error").path("message"));
        }

        return new WebhookEvent(
                type,
                WebhookEventKind.classify(type),
                text(object.path("id")),
                text(metadata.path(PaymentIntentService.CORRELATION_METADATA_KEY)),
                text(metadata.path("payoutItemId")),
                failureReason);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
