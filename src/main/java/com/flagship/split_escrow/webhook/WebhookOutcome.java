package com.flagship.split_escrow.webhook;

public enum WebhookOutcome {
    PROCESSED,
    DUPLICATE,
    IGNORED
}
