package com.flagship.split_escrow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for settlement operations.
 *
 * Metrics exposed:
 * - split.calculations: Counter of split calculations, tagged by currency
 * - split.conservation.violations: Counter of currency conservation defects (should stay at 0)
 * - milestone.transitions: Counter tagged by source and target status
 * - escrow.transitions: Counter tagged by target status
 * - payout.batches.scheduled / payout.items: batch and per-item outcomes
 * - jobs.outcomes / jobs.duration: job runner results and handler latency
 * - webhook.deliveries: webhook outcomes tagged by provider
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter conservationViolations;
    private final Counter duplicateWebhooks;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.conservationViolations = Counter.builder("split.conservation.violations")
                .description("Number of detected currency conservation violations")
                .register(registry);

        this.duplicateWebhooks = Counter.builder("webhook.duplicates")
                .description("Webhook deliveries short-circuited as duplicates")
                .register(registry);
    }

    // ==================== Split Calculator ====================

    public void recordSplitCalculated(String currency, int recipients) {
        registry.counter("split.calculations",
                "currency", sanitizeTag(currency),
                "recipients", String.valueOf(recipients)
        ).increment();
    }

    public void recordConservationViolation() {
        conservationViolations.increment();
    }

    public double conservationViolationCount() {
        return conservationViolations.count();
    }

    // ==================== State Machines ====================

    public void recordMilestoneTransition(String from, String to) {
        registry.counter("milestone.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordEscrowTransition(String to) {
        registry.counter("escrow.transitions", "to", sanitizeTag(to)).increment();
    }

    // ==================== Payouts ====================

    public void recordPayoutBatchScheduled(String currency, String policy) {
        registry.counter("payout.batches.scheduled",
                "currency", sanitizeTag(currency),
                "placeholder_policy", sanitizeTag(policy)
        ).increment();
    }

    public void recordPayoutItemOutcome(String status) {
        registry.counter("payout.items", "status", sanitizeTag(status)).increment();
    }

    // ==================== Jobs ====================

    public void recordJobOutcome(String jobType, String outcome) {
        registry.counter("jobs.outcomes",
                "type", sanitizeTag(jobType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordJobDuration(String jobType, Duration duration) {
        Timer.builder("jobs.duration")
                .tag("type", sanitizeTag(jobType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    // ==================== Webhooks ====================

    public void recordWebhookOutcome(String provider, String outcome) {
        registry.counter("webhook.deliveries",
                "provider", sanitizeTag(provider),
                "outcome", sanitizeTag(outcome)
        ).increment();
        if ("DUPLICATE".equals(outcome)) {
            duplicateWebhooks.increment();
        }
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
