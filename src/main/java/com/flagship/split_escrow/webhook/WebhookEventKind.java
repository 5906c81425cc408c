package com.flagship.split_escrow.webhook;

import java.util.Locale;
import java.util.Set;

/**
 * What an inbound provider event means to the settlement engine.
 */
public enum WebhookEventKind {
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED,
    TRANSFER_PAID,
    TRANSFER_FAILED,
    IGNORED;

    private static final Set<String> PAYMENT_SUCCESS_TYPES =
            Set.of("payment_intent.succeeded", "order.paid", "payment.captured");

    public static WebhookEventKind classify(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return IGNORED;
        }
        String type = eventType.trim().toLowerCase(Locale.ROOT);
        if (type.equals("transfer.paid")) {
            return TRANSFER_PAID;
        }
        if (type.equals("transfer.failed")) {
            return TRANSFER_FAILED;
        }
        if (PAYMENT_SUCCESS_TYPES.contains(type)) {
            return PAYMENT_SUCCEEDED;
        }
        if (type.contains("failed")) {
            return PAYMENT_FAILED;
        }
        return IGNORED;
    }

    public boolean isPayment() {
        return this == PAYMENT_SUCCEEDED || this == PAYMENT_FAILED;
    }

    public boolean isTransfer() {
        return this == TRANSFER_PAID || this == TRANSFER_FAILED;
    }
}
