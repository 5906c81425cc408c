package com.flagship.split_escrow.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "jobs",
    indexes = {
        @Index(name = "idx_jobs_due", columnList = "type, status, next_run_at"),
        @Index(name = "idx_jobs_lease", columnList = "status, lease_expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 100)
    private String type;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    private int attempt;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "worker_id", length = 100)
    private String workerId;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static JobEntity fromDomain(Job job) {
        return new JobEntity(
            job.getId(),
            job.getType(),
            job.getPayload(),
            job.getStatus(),
            job.getPriority(),
            job.getAttempt(),
            job.getMaxAttempts(),
            job.getNextRunAt(),
            job.getLeaseExpiresAt(),
            job.getWorkerId(),
            job.getLastError(),
            job.getResult(),
            null,
            job.getCreatedAt(),
            job.getUpdatedAt()
        );
    }

    public Job toDomain() {
        return Job.builder()
                .id(id)
                .type(type)
                .payload(payload)
                .status(status)
                .priority(priority)
                .attempt(attempt)
                .maxAttempts(maxAttempts)
                .nextRunAt(nextRunAt)
                .leaseExpiresAt(leaseExpiresAt)
                .workerId(workerId)
                .lastError(lastError)
                .result(result)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    void updateFromDomain(Job job) {
        this.status = job.getStatus();
        this.attempt = job.getAttempt();
        this.nextRunAt = job.getNextRunAt();
        this.leaseExpiresAt = job.getLeaseExpiresAt();
        this.workerId = job.getWorkerId();
        this.lastError = job.getLastError();
        this.result = job.getResult();
        this.updatedAt = job.getUpdatedAt();
    }
}
