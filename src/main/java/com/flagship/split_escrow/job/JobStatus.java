package com.flagship.split_escrow.job;

/**
 * Job lifecycle.
 *
 * <pre>
 * QUEUED --lease--> LEASED --success--> SUCCEEDED
 * LEASED --failure, attempts left--> QUEUED (nextRunAt in the future)
 * LEASED --failure, attempts exhausted--> DLQ
 * LEASED --non-retryable failure--> DLQ
 * DLQ --operator requeue--> QUEUED
 * </pre>
 */
public enum JobStatus {
    QUEUED,
    LEASED,
    SUCCEEDED,
    DLQ;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DLQ;
    }
}
