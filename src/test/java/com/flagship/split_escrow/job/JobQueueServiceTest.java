package com.flagship.split_escrow.job;

import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.JobTypeNotFoundException;
import com.flagship.split_escrow.exception.SchemaValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Durable job queue: leasing, result reports, retries, dead-lettering and
 * operator requeue.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "jobs.backoff.base-delay-ms=1",
        "jobs.backoff.max-delay-ms=1"
})
@DisplayName("Job Queue Tests")
class JobQueueServiceTest {

    static final String FLAKY = "test.flaky";
    static final String SLOW = "test.slow";

    @TestConfiguration
    static class TestHandlers {

        @Bean
        FlakyHandler flakyHandler() {
            return new FlakyHandler();
        }

        @Bean
        JobHandler slowHandler() {
            JobDefinition definition = new JobDefinition(SLOW, JobPolicy.of(1, 1, 1), JobSchema.builder().build());
            return new JobHandler() {
                @Override
                public JobDefinition definition() {
                    return definition;
                }

                @Override
                public String handle(Job job) throws Exception {
                    Thread.sleep(5_000);
                    return "too late";
                }
            };
        }
    }

    /**
     * Fails a configurable number of times, then succeeds.
     */
    static class FlakyHandler implements JobHandler {

        private static final JobDefinition DEFINITION = new JobDefinition(
                FLAKY,
                JobPolicy.of(3, 5, 2),
                JobSchema.builder().required("orderId", FieldType.STRING).build());

        final AtomicInteger failuresLeft = new AtomicInteger();
        final AtomicInteger executions = new AtomicInteger();
        volatile boolean permanent;
        final List<UUID> deadLettered = new CopyOnWriteArrayList<>();

        @Override
        public JobDefinition definition() {
            return DEFINITION;
        }

        @Override
        public String handle(Job job) {
            executions.incrementAndGet();
            if (permanent) {
                throw new NonRetryableJobException("order is gone");
            }
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IllegalStateException("downstream unavailable");
            }
            return "processed";
        }

        @Override
        public void onDeadLetter(Job job, String lastError) {
            deadLettered.add(job.getId());
        }

        void reset() {
            failuresLeft.set(0);
            executions.set(0);
            permanent = false;
            deadLettered.clear();
        }
    }

    @Autowired
    private JobQueueService queue;

    @Autowired
    private JobRunner runner;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private FlakyHandler flakyHandler;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        flakyHandler.reset();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private UUID enqueueFlaky() {
        return queue.enqueue(FLAKY, Map.of("orderId", UUID.randomUUID().toString()));
    }

    private static void pause() throws InterruptedException {
        Thread.sleep(20);
    }

    @Nested
    @DisplayName("Enqueue")
    class Enqueue {

        @Test
        @DisplayName("payloads are validated against the registered schema")
        void validatesPayload() {
            SchemaValidationException e = assertThrows(SchemaValidationException.class,
                    () -> queue.enqueue(FLAKY, Map.of("orderId", 7)));
            assertEquals(List.of("orderId"), e.getFields());

            assertThrows(JobTypeNotFoundException.class, () -> queue.enqueue("test.unknown", Map.of()));
            assertEquals(0, jobRepository.count());
        }

        @Test
        @DisplayName("enqueue applies the registered policy unless overridden")
        void appliesPolicy() {
            Job defaults = queue.getJob(enqueueFlaky());
            assertEquals(3, defaults.getMaxAttempts());
            assertEquals(JobPolicy.DEFAULT_PRIORITY, defaults.getPriority());

            Instant later = Instant.now().plusSeconds(600);
            Job custom = queue.getJob(queue.enqueue(FLAKY, Map.of("orderId", "x"), 90, later, 7));
            assertEquals(7, custom.getMaxAttempts());
            assertEquals(90, custom.getPriority());
            assertTrue(queue.lease("worker-a", FLAKY, 10, 30).stream().noneMatch(job -> job.getId().equals(custom.getId())),
                    "A job scheduled in the future must not be leased");
        }
    }

    @Nested
    @DisplayName("Leasing")
    class Leasing {

        @Test
        @DisplayName("a job is leased by one worker only")
        void exclusiveLeases() {
            printTestHeader("Exclusive leases");
            for (int i = 0; i < 3; i++) {
                enqueueFlaky();
            }

            List<Job> first = queue.lease("worker-a", FLAKY, 2, 30);
            List<Job> second = queue.lease("worker-b", FLAKY, 5, 30);
            List<Job> third = queue.lease("worker-c", FLAKY, 5, 30);

            assertEquals(2, first.size());
            assertEquals(1, second.size());
            assertTrue(third.isEmpty());
            assertTrue(first.stream().allMatch(job -> job.isLeasedBy("worker-a")));
            assertNotEquals(first.get(0).getId(), second.get(0).getId());
            printSuccess("Three jobs leased exactly once across three workers");
        }

        @Test
        @DisplayName("higher priority jobs are leased first")
        void priorityOrder() {
            UUID low = queue.enqueue(FLAKY, Map.of("orderId", "low"), 10, null, null);
            UUID high = queue.enqueue(FLAKY, Map.of("orderId", "high"), 90, null, null);

            List<Job> leased = queue.lease("worker-a", FLAKY, 1, 30);

            assertEquals(high, leased.get(0).getId());
            assertEquals(JobStatus.QUEUED, queue.getJob(low).getStatus());
        }

        @Test
        @DisplayName("reports from a worker that does not hold the lease are ignored")
        void wrongWorkerReport() {
            UUID jobId = enqueueFlaky();
            queue.lease("worker-a", FLAKY, 1, 30);

            assertFalse(queue.reportSuccess(jobId, "worker-b", "stolen"));
            assertTrue(queue.reportFailure(jobId, "worker-b", "stolen").isEmpty());
            assertEquals(JobStatus.LEASED, queue.getJob(jobId).getStatus());

            assertTrue(queue.reportSuccess(jobId, "worker-a", "done"));
            Job done = queue.getJob(jobId);
            assertEquals(JobStatus.SUCCEEDED, done.getStatus());
            assertEquals("done", done.getResult());
            assertFalse(queue.reportSuccess(jobId, "worker-a", "again"));
        }

        @Test
        @DisplayName("expired leases are reclaimed as failed attempts")
        void reclaimExpiredLease() throws InterruptedException {
            printTestHeader("Lease reclaim");
            UUID jobId = enqueueFlaky();
            queue.lease("worker-a", FLAKY, 1, 0);
            pause();

            assertEquals(1, queue.reclaimExpiredLeases());

            Job reclaimed = queue.getJob(jobId);
            assertEquals(JobStatus.QUEUED, reclaimed.getStatus());
            assertEquals(1, reclaimed.getAttempt());
            assertTrue(reclaimed.getLastError().contains("Lease expired"));
            assertFalse(queue.reportSuccess(jobId, "worker-a", "late"), "A late report after reclaim must be ignored");
            printSuccess("Job returned to the queue after its lease expired");
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("a failing job is retried with backoff until it succeeds")
        void retryUntilSuccess() throws InterruptedException {
            printTestHeader("Retry until success");
            flakyHandler.failuresLeft.set(2);
            UUID jobId = enqueueFlaky();

            runner.runOnce();
            Job afterFirst = queue.getJob(jobId);
            assertEquals(JobStatus.QUEUED, afterFirst.getStatus());
            assertEquals(1, afterFirst.getAttempt());
            assertTrue(afterFirst.getLastError().contains("downstream unavailable"));

            pause();
            runner.runOnce();
            pause();
            runner.runOnce();

            Job done = queue.getJob(jobId);
            assertEquals(JobStatus.SUCCEEDED, done.getStatus());
            assertEquals(2, done.getAttempt());
            assertEquals("processed", done.getResult());
            assertEquals(3, flakyHandler.executions.get());
            printSuccess("Job succeeded on attempt 3");
        }

        @Test
        @DisplayName("exhausting attempts moves the job to DLQ and runs the dead-letter hook once")
        void deadLetter() throws InterruptedException {
            printTestHeader("Dead letter");
            flakyHandler.failuresLeft.set(100);
            UUID jobId = enqueueFlaky();

            for (int i = 0; i < 5; i++) {
                runner.runOnce();
                pause();
            }

            Job dead = queue.getJob(jobId);
            assertEquals(JobStatus.DLQ, dead.getStatus());
            assertEquals(3, dead.getAttempt());
            assertEquals(3, flakyHandler.executions.get());
            assertEquals(List.of(jobId), flakyHandler.deadLettered);
            assertTrue(queue.deadLetters().stream().anyMatch(job -> job.getId().equals(jobId)));
            printSuccess("Job dead-lettered after 3 attempts");
        }

        @Test
        @DisplayName("a non-retryable error dead-letters the job at once; requeue gives it a fresh budget")
        void permanentFailureAndRequeue() {
            printTestHeader("Permanent failure goes to the dead-letter queue");
            flakyHandler.permanent = true;
            UUID jobId = enqueueFlaky();

            runner.runOnce();

            Job failed = queue.getJob(jobId);
            assertEquals(JobStatus.DLQ, failed.getStatus());
            assertEquals(1, failed.getAttempt());
            assertEquals("order is gone", failed.getLastError());
            assertEquals(1, flakyHandler.executions.get());
            assertEquals(List.of(jobId), flakyHandler.deadLettered);
            assertTrue(queue.deadLetters().stream().anyMatch(job -> job.getId().equals(jobId)));

            flakyHandler.permanent = false;
            Job requeued = queue.requeueDeadLetter(jobId);
            assertEquals(JobStatus.QUEUED, requeued.getStatus());
            assertEquals(0, requeued.getAttempt());

            runner.runOnce();
            assertEquals(JobStatus.SUCCEEDED, queue.getJob(jobId).getStatus());

            ConflictException e = assertThrows(ConflictException.class, () -> queue.requeueDeadLetter(jobId));
            assertEquals(ErrorCode.INVALID_TRANSITION, e.getErrorCode());
            printSuccess("Permanent failure listed as dead letter, ran its hook and was requeued");
        }

        @Test
        @DisplayName("a handler that exceeds its timeout counts as a failed attempt")
        void timeout() {
            UUID jobId = queue.enqueue(SLOW, Map.of());

            runner.runOnce();

            Job timedOut = queue.getJob(jobId);
            assertEquals(JobStatus.DLQ, timedOut.getStatus());
            assertTrue(timedOut.getLastError().startsWith("Timed out"));
        }

        @Test
        @DisplayName("failure reports return the updated job")
        void reportFailureReturnsJob() {
            UUID jobId = enqueueFlaky();
            queue.lease("worker-a", FLAKY, 1, 30);

            Optional<Job> failed = queue.reportFailure(jobId, "worker-a", "boom");

            assertTrue(failed.isPresent());
            assertEquals(JobStatus.QUEUED, failed.get().getStatus());
            assertEquals(1, queue.countByStatus(JobStatus.QUEUED));
        }
    }
}
