package com.flagship.split_escrow.webhook;

import lombok.Value;

/**
 * The fields of a provider event the reconciler depends on.
 */
@Value
public class WebhookEvent {
    String type;
    WebhookEventKind kind;
    String objectId;
    String correlationId;
    String payoutItemId;
    String failureReason;
}
