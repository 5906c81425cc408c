package com.flagship.split_escrow.job;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for failed job attempts.
 *
 * Delay: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * scaled by a random factor in [0.5, 1.5) and capped again.
 */
@Component
public class RetryBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryBackoff(@Value("${jobs.backoff.base-delay-ms:1000}") long baseDelayMs,
                        @Value("${jobs.backoff.max-delay-ms:300000}") long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * @param attempt failed attempts so far, starting at 1
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            // shift beyond maxDelay/baseDelay would overflow
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        long withJitter = (long) (capped * jitter);
        return Duration.ofMillis(Math.min(maxDelayMs, Math.max(0L, withJitter)));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
