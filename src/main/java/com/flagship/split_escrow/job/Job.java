package com.flagship.split_escrow.job;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of asynchronous work.
 *
 * The payload is the JSON document that passed schema validation at enqueue
 * time. {@code attempt} counts failed executions (handler error, timeout,
 * expired lease).
 */
@Value
@Builder(toBuilder = true)
public class Job {
    UUID id;
    String type;
    String payload;
    JobStatus status;
    int priority;
    int attempt;
    int maxAttempts;
    Instant nextRunAt;
    Instant leaseExpiresAt;
    String workerId;
    String lastError;
    String result;
    Instant createdAt;
    Instant updatedAt;

    public static Job create(String type, String payload, int priority, int maxAttempts, Instant runAt) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Instant now = Instant.now();
        return Job.builder()
                .id(UUID.randomUUID())
                .type(type)
                .payload(payload)
                .status(JobStatus.QUEUED)
                .priority(priority)
                .attempt(0)
                .maxAttempts(maxAttempts)
                .nextRunAt(runAt != null ? runAt : now)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Job succeed(String handlerResult) {
        requireStatus("complete", JobStatus.LEASED);
        return toBuilder()
                .status(JobStatus.SUCCEEDED)
                .result(handlerResult)
                .lastError(null)
                .leaseExpiresAt(null)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * Records a failed attempt. Returns to QUEUED at {@code retryAt} while
     * attempts remain, otherwise moves to DLQ.
     */
    public Job failAttempt(String error, Instant retryAt) {
        requireStatus("fail", JobStatus.LEASED);
        int attempts = attempt + 1;
        boolean exhausted = attempts >= maxAttempts;
        return toBuilder()
                .status(exhausted ? JobStatus.DLQ : JobStatus.QUEUED)
                .attempt(attempts)
                .nextRunAt(exhausted ? nextRunAt : retryAt)
                .lastError(error)
                .workerId(null)
                .leaseExpiresAt(null)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * Failure that no retry can fix: skips the remaining attempts and goes
     * straight to DLQ.
     */
    public Job failPermanently(String error) {
        requireStatus("fail", JobStatus.LEASED);
        return toBuilder()
                .status(JobStatus.DLQ)
                .attempt(attempt + 1)
                .lastError(error)
                .workerId(null)
                .leaseExpiresAt(null)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * Operator action: gives a dead-lettered job a fresh retry budget.
     */
    public Job requeue() {
        if (status != JobStatus.DLQ) {
            throw new IllegalStateException(
                String.format("Cannot requeue job %s in %s status. Only DLQ jobs can be requeued.", id, status));
        }
        Instant now = Instant.now();
        return toBuilder()
                .status(JobStatus.QUEUED)
                .attempt(0)
                .nextRunAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isLeasedBy(String worker) {
        return status == JobStatus.LEASED && worker != null && worker.equals(workerId);
    }

    public boolean isDeadLettered() {
        return status == JobStatus.DLQ;
    }

    private void requireStatus(String operation, JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s job %s in %s status. Only %s jobs allow it.", operation, id, status, expected));
        }
    }
}
