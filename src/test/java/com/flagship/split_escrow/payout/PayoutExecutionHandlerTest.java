package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.SettlementFixtures;
import com.flagship.split_escrow.SettlementFixtures.ProjectSetup;
import com.flagship.split_escrow.job.Job;
import com.flagship.split_escrow.job.JobQueueService;
import com.flagship.split_escrow.job.JobRepository;
import com.flagship.split_escrow.job.JobRunner;
import com.flagship.split_escrow.job.JobStatus;
import com.flagship.split_escrow.milestone.Milestone;
import com.flagship.split_escrow.milestone.MilestoneStateMachine;
import com.flagship.split_escrow.payment.psp.SandboxPspGateway;
import com.flagship.split_escrow.payment.psp.TransferRequest;
import com.flagship.split_escrow.payment.psp.TransferResult;
import com.flagship.split_escrow.project.ProjectService;
import com.flagship.split_escrow.split.RevenueSplitService;
import com.flagship.split_escrow.webhook.WebhookOutcome;
import com.flagship.split_escrow.webhook.WebhookReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Payout batch execution through the job runner, with the sandbox provider
 * spied to inject transfer failures and asynchronous confirmations.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "jobs.backoff.base-delay-ms=1",
        "jobs.backoff.max-delay-ms=1"
})
@DisplayName("Payout Execution Tests")
class PayoutExecutionHandlerTest {

    private static final String SECRET = "test-secret";

    @SpyBean
    private SandboxPspGateway gateway;

    @Autowired
    private JobRunner runner;

    @Autowired
    private JobQueueService jobQueue;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private PayoutBatchService batchService;

    @Autowired
    private PayoutExecutionHandler executionHandler;

    @Autowired
    private WebhookReconciler reconciler;

    @Autowired
    private MilestoneStateMachine stateMachine;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private RevenueSplitService splitService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private ProjectSetup project;
    private PayoutBatch batch;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        SettlementFixtures fixtures = new SettlementFixtures(projectService, splitService, stateMachine);
        project = fixtures.projectWithTwoRecipients();
        Milestone completed = fixtures.completedMilestone(project, 10_000);
        batch = stateMachine.approve(completed.getId(), project.getOwnerId()).getPayoutBatch();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private UUID firstRecipient() {
        return project.getRecipients().get(0);
    }

    private UUID secondRecipient() {
        return project.getRecipients().get(1);
    }

    private PayoutItem itemFor(PayoutBatch current, UUID recipient) {
        return current.getItems().stream()
                .filter(item -> recipient.equals(item.getRecipientId()))
                .findFirst()
                .orElseThrow();
    }

    private static String transferEvent(String type, String transferId, UUID itemId, String failure) {
        return "{\"type\":\"" + type + "\",\"data\":{\"object\":{\"id\":\"" + transferId + "\","
                + (failure != null ? "\"failure_message\":\"" + failure + "\"," : "")
                + "\"metadata\":{\"payoutItemId\":\"" + itemId + "\"}}}}";
    }

    private static void pause() throws InterruptedException {
        Thread.sleep(20);
    }

    @Test
    @DisplayName("a batch job pays every item and completes the batch")
    void paysAllItems() {
        printTestHeader("Batch execution");

        assertEquals(1, runner.runOnce());

        PayoutBatch paid = batchService.getBatch(batch.getId());
        assertEquals(PayoutStatus.PAID, paid.getStatus());
        assertTrue(paid.getItems().stream().allMatch(item -> item.isPaid()
                && item.getProviderTransferId().startsWith("sbx_tr_")
                && item.getAttempts() == 1));
        Job job = jobQueue.getJob(batch.getJobId());
        assertEquals(JobStatus.SUCCEEDED, job.getStatus());
        assertTrue(job.getResult().contains("paid=2"));
        printSuccess("Both recipients paid: " + job.getResult());
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failed transfer fails the job and the retry pays only the failed item")
        void retryPaysOnlyFailedItems() throws InterruptedException {
            printTestHeader("Partial failure and retry");
            AtomicBoolean failing = new AtomicBoolean(true);
            doAnswer(invocation -> {
                TransferRequest request = invocation.getArgument(0);
                if (failing.get() && request.getRecipientId().equals(secondRecipient())) {
                    return TransferResult.failed("account frozen");
                }
                return invocation.callRealMethod();
            }).when(gateway).captureAndTransfer(any());

            runner.runOnce();

            PayoutBatch afterFirst = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.PROCESSING, afterFirst.getStatus());
            assertTrue(itemFor(afterFirst, firstRecipient()).isPaid());
            PayoutItem failedItem = itemFor(afterFirst, secondRecipient());
            assertEquals(PayoutStatus.FAILED, failedItem.getStatus());
            assertEquals("account frozen", failedItem.getFailureReason());
            Job job = jobQueue.getJob(batch.getJobId());
            assertEquals(JobStatus.QUEUED, job.getStatus());
            assertEquals(1, job.getAttempt());

            failing.set(false);
            pause();
            runner.runOnce();

            PayoutBatch afterRetry = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.PAID, afterRetry.getStatus());
            assertEquals(2, itemFor(afterRetry, secondRecipient()).getAttempts());
            assertEquals(1, itemFor(afterRetry, firstRecipient()).getAttempts());
            verify(gateway, times(1)).captureAndTransfer(argThat(request -> request != null
                    && request.getRecipientId().equals(firstRecipient())));
            verify(gateway, times(2)).captureAndTransfer(argThat(request -> request != null
                    && request.getRecipientId().equals(secondRecipient())));
            assertEquals(JobStatus.SUCCEEDED, jobQueue.getJob(batch.getJobId()).getStatus());
            printSuccess("Retry paid only the failed item");
        }

        @Test
        @DisplayName("provider exceptions are recorded as failed transfers")
        void providerException() {
            doAnswer(invocation -> {
                throw new IllegalStateException("connection reset");
            }).when(gateway).captureAndTransfer(any());

            runner.runOnce();

            PayoutBatch current = batchService.getBatch(batch.getId());
            assertTrue(current.getItems().stream().allMatch(item -> item.getStatus() == PayoutStatus.FAILED));
            assertTrue(itemFor(current, firstRecipient()).getFailureReason().contains("connection reset"));
            assertEquals(JobStatus.QUEUED, jobQueue.getJob(batch.getJobId()).getStatus());
        }

        @Test
        @DisplayName("an escrow that is no longer RELEASED aborts the batch without transfers")
        void abortedEscrow() {
            printTestHeader("Escrow changed before payout");
            jdbcTemplate.update("UPDATE escrows SET status = 'REFUNDED' WHERE id = ?", batch.getEscrowId());

            runner.runOnce();

            PayoutBatch aborted = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.FAILED, aborted.getStatus());
            assertTrue(aborted.getItems().stream().allMatch(item -> item.getStatus() == PayoutStatus.FAILED));
            Job job = jobQueue.getJob(batch.getJobId());
            assertEquals(JobStatus.DLQ, job.getStatus());
            assertTrue(job.getLastError().contains("payout aborted"));
            assertTrue(jobQueue.deadLetters().stream().anyMatch(dead -> dead.getId().equals(job.getId())));
            verify(gateway, times(0)).captureAndTransfer(any());
            printSuccess("Batch aborted, no money moved");
        }

        @Test
        @DisplayName("a payload naming the wrong escrow is dead-lettered without touching the batch")
        void escrowMismatch() {
            jobRepository.deleteAll();
            UUID jobId = jobQueue.enqueue(PayoutExecutionHandler.JOB_TYPE, Map.of(
                    "batchId", batch.getId().toString(),
                    "escrowId", UUID.randomUUID().toString()));

            runner.runOnce();

            Job job = jobQueue.getJob(jobId);
            assertEquals(JobStatus.DLQ, job.getStatus());
            assertTrue(job.getLastError().contains("belongs to escrow"));
            assertEquals(PayoutStatus.SCHEDULED, batchService.getBatch(batch.getId()).getStatus());
        }

        @Test
        @DisplayName("the dead-letter hook marks the batch FAILED but keeps item state")
        void deadLetterMarksBatchFailed() {
            Job job = jobQueue.getJob(batch.getJobId());

            executionHandler.onDeadLetter(job, "gave up");

            PayoutBatch failed = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.FAILED, failed.getStatus());
            assertTrue(failed.getItems().stream().allMatch(item -> item.getStatus() == PayoutStatus.SCHEDULED));
        }
    }

    @Nested
    @DisplayName("Transfer confirmations")
    class TransferConfirmations {

        @Test
        @DisplayName("pending transfers settle from webhooks and a failed one is retried")
        void webhookSettlement() throws InterruptedException {
            printTestHeader("Asynchronous transfer confirmation");
            AtomicBoolean pending = new AtomicBoolean(true);
            doAnswer(invocation -> {
                TransferRequest request = invocation.getArgument(0);
                if (pending.get()) {
                    return TransferResult.pending("tr_" + request.getIdempotencyKey());
                }
                return invocation.callRealMethod();
            }).when(gateway).captureAndTransfer(any());

            runner.runOnce();

            PayoutBatch awaiting = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.PROCESSING, awaiting.getStatus());
            assertEquals(JobStatus.SUCCEEDED, jobQueue.getJob(batch.getJobId()).getStatus());
            PayoutItem first = itemFor(awaiting, firstRecipient());
            PayoutItem second = itemFor(awaiting, secondRecipient());
            assertEquals("tr_" + first.getId(), first.getProviderTransferId());

            String paidEvent = transferEvent("transfer.paid", first.getProviderTransferId(), first.getId(), null);
            assertEquals(WebhookOutcome.PROCESSED, reconciler.receive(SandboxPspGateway.PROVIDER, paidEvent, SECRET));
            assertEquals(WebhookOutcome.DUPLICATE, reconciler.receive(SandboxPspGateway.PROVIDER, paidEvent, SECRET));

            String failedEvent = transferEvent("transfer.failed", second.getProviderTransferId(), second.getId(),
                    "recipient account closed");
            assertEquals(WebhookOutcome.PROCESSED, reconciler.receive(SandboxPspGateway.PROVIDER, failedEvent, SECRET));

            PayoutBatch afterWebhooks = batchService.getBatch(batch.getId());
            assertTrue(itemFor(afterWebhooks, firstRecipient()).isPaid());
            assertEquals("recipient account closed", itemFor(afterWebhooks, secondRecipient()).getFailureReason());
            assertEquals(2, jobQueue.jobsOfType(PayoutExecutionHandler.JOB_TYPE).size());

            pending.set(false);
            pause();
            runner.runOnce();

            PayoutBatch settled = batchService.getBatch(batch.getId());
            assertEquals(PayoutStatus.PAID, settled.getStatus());
            assertEquals("tr_" + first.getId(), itemFor(settled, firstRecipient()).getProviderTransferId());
            assertTrue(itemFor(settled, secondRecipient()).getProviderTransferId().startsWith("sbx_tr_"));
            printSuccess("Batch settled after one webhook retry");
        }
    }
}
