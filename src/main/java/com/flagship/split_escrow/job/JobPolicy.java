package com.flagship.split_escrow.job;

import lombok.Value;

/**
 * Execution limits registered with a job type.
 */
@Value
public class JobPolicy {

    public static final int DEFAULT_PRIORITY = 50;

    int maxAttempts;
    int timeoutSeconds;
    int concurrencyLimit;
    int defaultPriority;

    public static JobPolicy of(int maxAttempts, int timeoutSeconds, int concurrencyLimit) {
        return new JobPolicy(maxAttempts, timeoutSeconds, concurrencyLimit, DEFAULT_PRIORITY);
    }

    public JobPolicy(int maxAttempts, int timeoutSeconds, int concurrencyLimit, int defaultPriority) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be at least 1");
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.timeoutSeconds = timeoutSeconds;
        this.concurrencyLimit = concurrencyLimit;
        this.defaultPriority = defaultPriority;
    }
}
