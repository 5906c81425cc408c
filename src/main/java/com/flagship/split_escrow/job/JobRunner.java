package com.flagship.split_escrow.job;

import com.flagship.split_escrow.observability.CorrelationContext;
import com.flagship.split_escrow.observability.SettlementMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Leases due jobs and runs them through their registered handlers.
 *
 * Each job type has a semaphore sized to its concurrency limit; permits are
 * taken before leasing, so this worker never holds more leases of a type than
 * it is allowed to run. Handlers run on a separate pool so the dispatching
 * thread can enforce the type's timeout.
 */
@Component
@Slf4j
public class JobRunner {

    private final JobQueueService queue;
    private final JobRegistry registry;
    private final SettlementMetrics metrics;
    private final String workerId;
    private final int leaseSeconds;
    private final int batchSize;

    private final Map<String, Semaphore> permits = new ConcurrentHashMap<>();
    private final ExecutorService dispatchPool;
    private final ExecutorService handlerPool;

    public JobRunner(JobQueueService queue,
                     JobRegistry registry,
                     SettlementMetrics metrics,
                     @Value("${jobs.runner.worker-id:worker-1}") String workerId,
                     @Value("${jobs.runner.max-concurrency:8}") int maxConcurrency,
                     @Value("${jobs.runner.lease-seconds:120}") int leaseSeconds,
                     @Value("${jobs.runner.batch-size:10}") int batchSize) {
        this.queue = queue;
        this.registry = registry;
        this.metrics = metrics;
        this.workerId = workerId;
        this.leaseSeconds = leaseSeconds;
        this.batchSize = batchSize;
        this.dispatchPool = Executors.newFixedThreadPool(maxConcurrency);
        this.handlerPool = Executors.newCachedThreadPool();
    }

    /**
     * Leases due jobs and hands them to the dispatch pool without waiting.
     */
    public void pollAndDispatch() {
        for (JobDefinition definition : registry.definitions()) {
            Semaphore semaphore = semaphoreFor(definition);
            for (Job job : claim(definition, semaphore)) {
                dispatchPool.submit(() -> {
                    try {
                        execute(job, definition);
                    } finally {
                        semaphore.release();
                    }
                });
            }
        }
    }

    /**
     * Leases and runs due jobs on the calling thread.
     *
     * @return number of jobs executed
     */
    public int runOnce() {
        int executed = 0;
        for (JobDefinition definition : registry.definitions()) {
            Semaphore semaphore = semaphoreFor(definition);
            for (Job job : claim(definition, semaphore)) {
                try {
                    execute(job, definition);
                    executed++;
                } finally {
                    semaphore.release();
                }
            }
        }
        return executed;
    }

    public String getWorkerId() {
        return workerId;
    }

    private List<Job> claim(JobDefinition definition, Semaphore semaphore) {
        int acquired = 0;
        while (acquired < batchSize && semaphore.tryAcquire()) {
            acquired++;
        }
        if (acquired == 0) {
            return List.of();
        }

        List<Job> leased = new ArrayList<>();
        try {
            leased.addAll(queue.lease(workerId, definition.getType(), acquired, leaseSeconds));
        } catch (RuntimeException e) {
            log.error("Failed to lease jobs of type {}", definition.getType(), e);
        }
        semaphore.release(acquired - leased.size());
        return leased;
    }

    void execute(Job job, JobDefinition definition) {
        CorrelationContext.setCorrelationId(CorrelationContext.generateCorrelationId());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, job.getId().toString());
        long started = System.nanoTime();
        try {
            log.info("Executing job: jobId={}, type={}, attempt={}/{}",
                    job.getId(), job.getType(), job.getAttempt() + 1, job.getMaxAttempts());

            JobHandler handler = registry.handlerFor(job.getType());
            Future<String> future = handlerPool.submit(() -> handler.handle(job));
            String result = awaitResult(future, definition.getPolicy().getTimeoutSeconds());
            queue.reportSuccess(job.getId(), workerId, result);

        } catch (TimeoutException e) {
            queue.reportFailure(job.getId(), workerId,
                    "Timed out after " + definition.getPolicy().getTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.reportFailure(job.getId(), workerId, "Interrupted while waiting for handler");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof NonRetryableJobException) {
                queue.reportPermanentFailure(job.getId(), workerId, cause.getMessage());
            } else {
                log.warn("Job handler failed: jobId={}, type={}", job.getId(), job.getType(), cause);
                queue.reportFailure(job.getId(), workerId, describe(cause));
            }
        } catch (RuntimeException e) {
            log.error("Job execution error: jobId={}, type={}", job.getId(), job.getType(), e);
            queue.reportFailure(job.getId(), workerId, describe(e));
        } finally {
            metrics.recordJobDuration(job.getType(), Duration.ofNanos(System.nanoTime() - started));
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    private static String awaitResult(Future<String> future, int timeoutSeconds)
            throws InterruptedException, ExecutionException, TimeoutException {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private Semaphore semaphoreFor(JobDefinition definition) {
        return permits.computeIfAbsent(definition.getType(),
                type -> new Semaphore(definition.getPolicy().getConcurrencyLimit()));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    @PreDestroy
    public void shutdown() {
        dispatchPool.shutdown();
        handlerPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(10, TimeUnit.SECONDS)) {
                dispatchPool.shutdownNow();
            }
            if (!handlerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                handlerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatchPool.shutdownNow();
            handlerPool.shutdownNow();
        }
    }
}
