package com.flagship.split_escrow.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_escrow.event.JobDeadLetteredEvent;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.observability.SettlementMetrics;
import com.flagship.split_escrow.port.EventPublisherPort;
import com.flagship.split_escrow.port.JobQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job queue on top of the jobs table.
 *
 * Leasing is a conditional update on QUEUED rows, so a job is held by at most
 * one worker at a time. Result reports are accepted only from the worker that
 * holds the lease; a late report from a worker whose lease expired and was
 * reclaimed is ignored.
 *
 * Dead-letter hooks run after the DLQ transition has committed so that a
 * failing hook cannot undo it.
 */
@Service
@Slf4j
public class JobQueueService implements JobQueuePort {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobRepository repository;
    private final JobRegistry registry;
    private final RetryBackoff backoff;
    private final EventPublisherPort eventPublisher;
    private final SettlementMetrics metrics;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public JobQueueService(JobRepository repository,
                           JobRegistry registry,
                           RetryBackoff backoff,
                           EventPublisherPort eventPublisher,
                           SettlementMetrics metrics,
                           ObjectMapper objectMapper,
                           PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.registry = registry;
        this.backoff = backoff;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Enqueues with the registered policy. Joins the caller's transaction, so
     * the job exists only if the caller commits.
     */
    @Override
    @Transactional
    public UUID enqueue(String jobType, Map<String, Object> payload) {
        return enqueue(jobType, payload, null, null, null);
    }

    @Transactional
    public UUID enqueue(String jobType, Map<String, Object> payload,
                        Integer priority, Instant runAt, Integer maxAttempts) {
        JobDefinition definition = registry.validate(jobType, payload);
        JobPolicy policy = definition.getPolicy();

        Job job = Job.create(
                jobType,
                serialize(payload),
                priority != null ? priority : policy.getDefaultPriority(),
                maxAttempts != null ? maxAttempts : policy.getMaxAttempts(),
                runAt);
        repository.save(JobEntity.fromDomain(job));

        log.info("Job enqueued: jobId={}, type={}, priority={}, maxAttempts={}, runAt={}",
                job.getId(), jobType, job.getPriority(), job.getMaxAttempts(), job.getNextRunAt());
        metrics.recordJobOutcome(jobType, "enqueued");
        return job.getId();
    }

    /**
     * Leases up to {@code limit} due jobs of one type for this worker.
     */
    @Transactional
    public List<Job> lease(String workerId, String jobType, int limit, int leaseSeconds) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = Instant.now();
        List<UUID> candidates = repository.findDueJobIds(jobType, JobStatus.QUEUED, now, PageRequest.of(0, limit));

        List<Job> leased = new ArrayList<>();
        Instant leaseExpiresAt = now.plusSeconds(leaseSeconds);
        for (UUID id : candidates) {
            int updated = repository.tryLease(id, workerId, leaseExpiresAt, now, JobStatus.QUEUED, JobStatus.LEASED);
            if (updated == 1) {
                repository.findById(id).map(JobEntity::toDomain).ifPresent(leased::add);
            } else {
                log.debug("Job {} was leased by another worker", id);
            }
        }

        if (!leased.isEmpty()) {
            log.debug("Leased {} jobs: type={}, worker={}", leased.size(), jobType, workerId);
        }
        return leased;
    }

    @Transactional
    public boolean reportSuccess(UUID jobId, String workerId, String result) {
        Optional<JobEntity> holder = lockedByWorker(jobId, workerId);
        if (holder.isEmpty()) {
            return false;
        }
        JobEntity entity = holder.get();
        Job completed = entity.toDomain().succeed(result);
        entity.updateFromDomain(completed);
        repository.save(entity);

        log.info("Job succeeded: jobId={}, type={}, attempt={}", jobId, completed.getType(), completed.getAttempt() + 1);
        metrics.recordJobOutcome(completed.getType(), "succeeded");
        return true;
    }

    /**
     * Records a retryable failure. The job goes back to QUEUED after a backoff
     * delay, or to DLQ once its attempts are exhausted.
     */
    public Optional<Job> reportFailure(UUID jobId, String workerId, String error) {
        Optional<Job> failed = transactionTemplate.execute(status -> {
            Optional<JobEntity> holder = lockedByWorker(jobId, workerId);
            if (holder.isEmpty()) {
                return Optional.<Job>empty();
            }
            return Optional.of(recordFailedAttempt(holder.get(), error));
        });
        failed.filter(Job::isDeadLettered).ifPresent(this::runDeadLetterHook);
        return failed;
    }

    /**
     * Records a failure that retrying cannot fix. The job is dead-lettered
     * immediately, whatever attempts it had left.
     */
    public Optional<Job> reportPermanentFailure(UUID jobId, String workerId, String error) {
        Optional<Job> failed = transactionTemplate.execute(status -> {
            Optional<JobEntity> holder = lockedByWorker(jobId, workerId);
            if (holder.isEmpty()) {
                return Optional.<Job>empty();
            }
            JobEntity entity = holder.get();
            Job dead = entity.toDomain().failPermanently(truncate(error));
            entity.updateFromDomain(dead);
            repository.save(entity);

            log.error("Job failed permanently and was dead-lettered: jobId={}, type={}, error={}",
                    jobId, dead.getType(), dead.getLastError());
            metrics.recordJobOutcome(dead.getType(), "dead_lettered");
            eventPublisher.publish(JobDeadLetteredEvent.of(dead.getId(), dead.getType(),
                    dead.getAttempt(), dead.getLastError()));
            return Optional.of(dead);
        });
        failed.ifPresent(this::runDeadLetterHook);
        return failed;
    }

    /**
     * Returns jobs whose lease expired to the queue. An expired lease counts
     * as a failed attempt.
     *
     * @return number of reclaimed jobs
     */
    public int reclaimExpiredLeases() {
        List<UUID> expired = repository.findExpiredLeaseIds(JobStatus.LEASED, Instant.now());
        int reclaimed = 0;
        for (UUID jobId : expired) {
            Job job = transactionTemplate.execute(status -> repository.findByIdForUpdate(jobId)
                    .filter(entity -> entity.getStatus() == JobStatus.LEASED
                            && entity.getLeaseExpiresAt() != null
                            && entity.getLeaseExpiresAt().isBefore(Instant.now()))
                    .map(entity -> {
                        log.warn("Reclaiming expired lease: jobId={}, type={}, worker={}",
                                jobId, entity.getType(), entity.getWorkerId());
                        metrics.recordJobOutcome(entity.getType(), "lease_expired");
                        return recordFailedAttempt(entity, "Lease expired on worker " + entity.getWorkerId());
                    })
                    .orElse(null));
            if (job != null) {
                reclaimed++;
                if (job.isDeadLettered()) {
                    runDeadLetterHook(job);
                }
            }
        }
        return reclaimed;
    }

    /**
     * Operator action: puts a DLQ job back on the queue with a fresh attempt
     * budget.
     */
    @Transactional
    public Job requeueDeadLetter(UUID jobId) {
        JobEntity entity = repository.findByIdForUpdate(jobId).orElseThrow(() -> notFound(jobId));
        Job current = entity.toDomain();
        if (current.getStatus() != JobStatus.DLQ) {
            throw new ConflictException(ErrorCode.INVALID_TRANSITION,
                    "Job " + jobId + " is " + current.getStatus() + "; only DLQ jobs can be requeued");
        }
        Job requeued = current.requeue();
        entity.updateFromDomain(requeued);
        repository.save(entity);

        log.info("Job requeued by operator: jobId={}, type={}", jobId, requeued.getType());
        metrics.recordJobOutcome(requeued.getType(), "requeued");
        return requeued;
    }

    @Transactional(readOnly = true)
    public Job getJob(UUID jobId) {
        return repository.findById(jobId).map(JobEntity::toDomain).orElseThrow(() -> notFound(jobId));
    }

    @Transactional(readOnly = true)
    public List<Job> deadLetters() {
        return repository.findByStatusOrderByUpdatedAtDesc(JobStatus.DLQ)
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Job> jobsOfType(String jobType) {
        return repository.findByTypeOrderByCreatedAtAsc(jobType)
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countByStatus(JobStatus status) {
        return repository.countByStatus(status);
    }

    private Job recordFailedAttempt(JobEntity entity, String error) {
        Job current = entity.toDomain();
        Instant retryAt = Instant.now().plus(backoff.delayFor(current.getAttempt() + 1));
        Job failed = current.failAttempt(truncate(error), retryAt);
        entity.updateFromDomain(failed);
        repository.save(entity);

        if (failed.isDeadLettered()) {
            log.error("Job dead-lettered: jobId={}, type={}, attempts={}, lastError={}",
                    failed.getId(), failed.getType(), failed.getAttempt(), failed.getLastError());
            metrics.recordJobOutcome(failed.getType(), "dead_lettered");
            eventPublisher.publish(JobDeadLetteredEvent.of(failed.getId(), failed.getType(),
                    failed.getAttempt(), failed.getLastError()));
        } else {
            log.warn("Job attempt failed: jobId={}, type={}, attempt={}/{}, retryAt={}, error={}",
                    failed.getId(), failed.getType(), failed.getAttempt(), failed.getMaxAttempts(),
                    failed.getNextRunAt(), failed.getLastError());
            metrics.recordJobOutcome(failed.getType(), "retried");
        }
        return failed;
    }

    private Optional<JobEntity> lockedByWorker(UUID jobId, String workerId) {
        JobEntity entity = repository.findByIdForUpdate(jobId).orElseThrow(() -> notFound(jobId));
        if (!entity.toDomain().isLeasedBy(workerId)) {
            log.warn("Ignoring report for job {} from worker {}: job is {} and held by {}",
                    jobId, workerId, entity.getStatus(), entity.getWorkerId());
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    private void runDeadLetterHook(Job job) {
        try {
            registry.handlerFor(job.getType()).onDeadLetter(job, job.getLastError());
        } catch (RuntimeException e) {
            log.error("Dead-letter hook failed: jobId={}, type={}", job.getId(), job.getType(), e);
        }
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable", e);
        }
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    private static NotFoundException notFound(UUID jobId) {
        return new NotFoundException(ErrorCode.JOB_NOT_FOUND, "Job not found: " + jobId);
    }
}
