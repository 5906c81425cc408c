package com.flagship.split_escrow.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    private static Job leased(Job job) {
        return job.toBuilder()
                .status(JobStatus.LEASED)
                .workerId("worker-1")
                .leaseExpiresAt(Instant.now().plusSeconds(30))
                .build();
    }

    @Test
    @DisplayName("new jobs are queued with zero attempts")
    void createQueued() {
        Job job = Job.create("payout.execute", "{}", 10, 3, null);

        assertEquals(JobStatus.QUEUED, job.getStatus());
        assertEquals(0, job.getAttempt());
        assertNotNull(job.getNextRunAt());
        assertThrows(IllegalArgumentException.class, () -> Job.create("x", "{}", 10, 0, null));
    }

    @Test
    @DisplayName("failures requeue until attempts are exhausted, then dead-letter")
    void failureLifecycle() {
        Job job = Job.create("payout.execute", "{}", 10, 2, null);
        Instant retryAt = Instant.now().plusSeconds(5);

        Job afterFirst = leased(job).failAttempt("boom", retryAt);
        assertEquals(JobStatus.QUEUED, afterFirst.getStatus());
        assertEquals(1, afterFirst.getAttempt());
        assertEquals(retryAt, afterFirst.getNextRunAt());
        assertNull(afterFirst.getWorkerId());

        Job afterSecond = leased(afterFirst).failAttempt("boom again", Instant.now());
        assertEquals(JobStatus.DLQ, afterSecond.getStatus());
        assertEquals(2, afterSecond.getAttempt());
        assertEquals("boom again", afterSecond.getLastError());
        assertTrue(afterSecond.isDeadLettered());
    }

    @Test
    @DisplayName("only leased jobs can complete or fail")
    void requiresLease() {
        Job job = Job.create("payout.execute", "{}", 10, 3, null);

        assertThrows(IllegalStateException.class, () -> job.succeed("done"));
        assertThrows(IllegalStateException.class, () -> job.failAttempt("x", Instant.now()));
        assertThrows(IllegalStateException.class, () -> job.failPermanently("x"));

        Job done = leased(job).succeed("done");
        assertEquals(JobStatus.SUCCEEDED, done.getStatus());
        assertEquals("done", done.getResult());
        assertTrue(done.getStatus().isTerminal());
    }

    @Test
    @DisplayName("a permanent failure dead-letters at once and requeue resets attempts")
    void requeue() {
        Job job = Job.create("payout.execute", "{}", 10, 5, null);
        Job failed = leased(job).failPermanently("bad payload");

        assertEquals(JobStatus.DLQ, failed.getStatus());
        assertTrue(failed.isDeadLettered());
        assertEquals(1, failed.getAttempt());
        Job requeued = failed.requeue();
        assertEquals(JobStatus.QUEUED, requeued.getStatus());
        assertEquals(0, requeued.getAttempt());

        assertThrows(IllegalStateException.class, job::requeue);
    }

    @Test
    @DisplayName("lease ownership is checked by worker id")
    void leaseOwnership() {
        Job job = leased(Job.create("payout.execute", "{}", 10, 3, null));

        assertTrue(job.isLeasedBy("worker-1"));
        assertFalse(job.isLeasedBy("worker-2"));
        assertFalse(job.isLeasedBy(null));
    }
}
