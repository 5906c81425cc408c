package com.flagship.split_escrow.payout;

import com.flagship.split_escrow.SettlementFixtures;
import com.flagship.split_escrow.SettlementFixtures.ProjectSetup;
import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.escrow.Escrow;
import com.flagship.split_escrow.escrow.EscrowLedger;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.job.JobQueueService;
import com.flagship.split_escrow.milestone.Milestone;
import com.flagship.split_escrow.milestone.MilestoneStateMachine;
import com.flagship.split_escrow.payment.psp.SandboxPspGateway;
import com.flagship.split_escrow.project.ProjectService;
import com.flagship.split_escrow.split.RevenueSplit;
import com.flagship.split_escrow.split.RevenueSplitService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payout batch creation from released escrows.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Payout Scheduler Tests")
class PayoutSchedulerTest {

    @Autowired
    private PayoutScheduler scheduler;

    @Autowired
    private PayoutBatchService batchService;

    @Autowired
    private EscrowLedger escrowLedger;

    @Autowired
    private JobQueueService jobQueue;

    @Autowired
    private MilestoneStateMachine stateMachine;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private RevenueSplitService splitService;

    private SettlementFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new SettlementFixtures(projectService, splitService, stateMachine);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Escrow releasedEscrow(ProjectSetup project, long amount) {
        Milestone milestone = fixtures.milestone(project, amount);
        Escrow locked = escrowLedger.lock(milestone.getId(), project.getProjectId(), UUID.randomUUID(), amount,
                CurrencyCode.USD, SandboxPspGateway.PROVIDER, "sbx_pi_" + UUID.randomUUID());
        return escrowLedger.release(locked.getId());
    }

    private PayoutBatch schedule(Escrow escrow, PlaceholderPolicy policy) {
        return scheduler.schedulePayouts(escrow.getId(), escrow.getProjectId(), escrow.getMilestoneId(),
                escrow.getAmount(), escrow.getCurrency(), policy);
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("a second schedule for the same escrow fails ALREADY_SCHEDULED")
        void secondScheduleRejected() {
            printTestHeader("Idempotent scheduling");
            Escrow escrow = releasedEscrow(fixtures.projectWithTwoRecipients(), 10_000);

            PayoutBatch batch = schedule(escrow, PlaceholderPolicy.WITHHOLD);
            ConflictException e = assertThrows(ConflictException.class,
                    () -> schedule(escrow, PlaceholderPolicy.WITHHOLD));

            assertEquals(ErrorCode.ALREADY_SCHEDULED, e.getErrorCode());
            assertEquals(batch.getId(), batchService.getByEscrow(escrow.getId()).getId());
            assertEquals(PayoutExecutionHandler.JOB_TYPE, jobQueue.getJob(batch.getJobId()).getType());
            printSuccess("Only batch " + batch.getId() + " exists for escrow " + escrow.getId());
        }

        @Test
        @DisplayName("concurrent schedules for one escrow produce exactly one batch")
        void concurrentSchedules() throws InterruptedException {
            printTestHeader("Concurrent scheduling");
            Escrow escrow = releasedEscrow(fixtures.projectWithTwoRecipients(), 10_000);

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger succeeded = new AtomicInteger();
            List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        schedule(escrow, PlaceholderPolicy.WITHHOLD);
                        succeeded.incrementAndGet();
                    } catch (Throwable t) {
                        failures.add(t);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS), "Schedulers did not finish in time");
            executor.shutdown();

            assertEquals(1, succeeded.get(), "Exactly one scheduler must win");
            assertEquals(threads - 1, failures.size());
            for (Throwable failure : failures) {
                assertInstanceOf(ConflictException.class, failure, "Unexpected failure: " + failure);
                assertEquals(ErrorCode.ALREADY_SCHEDULED, ((ConflictException) failure).getErrorCode());
            }
            PayoutBatch batch = batchService.getByEscrow(escrow.getId());
            assertEquals(9500, batch.getTotalNet());
            printSuccess("One batch, " + failures.size() + " rejected duplicates");
        }

        @Test
        @DisplayName("an escrow that is not RELEASED cannot be paid out")
        void requiresReleasedEscrow() {
            ProjectSetup project = fixtures.projectWithTwoRecipients();
            Milestone milestone = fixtures.milestone(project, 10_000);
            Escrow locked = escrowLedger.lock(milestone.getId(), project.getProjectId(), UUID.randomUUID(), 10_000,
                    CurrencyCode.USD, SandboxPspGateway.PROVIDER, "sbx_pi_locked");

            ConflictException e = assertThrows(ConflictException.class,
                    () -> schedule(locked, PlaceholderPolicy.WITHHOLD));
            assertEquals(ErrorCode.INVALID_TRANSITION, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Placeholder policies")
    class PlaceholderPolicies {

        @Test
        @DisplayName("WITHHOLD keeps placeholder shares off the batch and records them as withheld")
        void withhold() {
            printTestHeader("Placeholder WITHHOLD");
            UUID owner = UUID.randomUUID();
            UUID recipient = UUID.randomUUID();
            ProjectSetup project = fixtures.projectWithSplits(owner, List.of(
                    RevenueSplit.ofRecipient(recipient, "50"),
                    RevenueSplit.ofPlaceholder("featured vocalist", "50")), Set.of(recipient));

            PayoutBatch batch = schedule(releasedEscrow(project, 10_000), PlaceholderPolicy.WITHHOLD);

            assertEquals(9500, batch.getNetPool());
            assertEquals(1, batch.getItems().size());
            assertEquals(recipient, batch.getItems().get(0).getRecipientId());
            assertEquals(4750, batch.getTotalNet());
            assertEquals(4750, batch.getWithheldAmount());
            assertEquals(batch.getNetPool(), batch.getTotalNet() + batch.getWithheldAmount());
            printSuccess("Withheld " + batch.getWithheldAmount() + " for the unfilled seat");
        }

        @Test
        @DisplayName("RENORMALIZE spreads the whole net pool over resolved recipients")
        void renormalize() {
            UUID owner = UUID.randomUUID();
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            ProjectSetup project = fixtures.projectWithSplits(owner, List.of(
                    RevenueSplit.ofRecipient(first, "30"),
                    RevenueSplit.ofRecipient(second, "30"),
                    RevenueSplit.ofPlaceholder("mixing engineer", "40")), Set.of(first, second));

            PayoutBatch batch = schedule(releasedEscrow(project, 10_000), PlaceholderPolicy.RENORMALIZE);

            assertEquals(PlaceholderPolicy.RENORMALIZE, batch.getPlaceholderPolicy());
            assertEquals(0, batch.getWithheldAmount());
            assertEquals(9500, batch.getTotalNet());
            assertEquals(List.of(4750L, 4750L), batch.getItems().stream().map(PayoutItem::getNetAmount).toList());
        }

        @Test
        @DisplayName("a split made only of placeholders fails NO_RECIPIENTS")
        void noRecipients() {
            ProjectSetup project = fixtures.projectWithSplits(UUID.randomUUID(), List.of(
                    RevenueSplit.ofPlaceholder("producer", "100")), Set.of());
            Escrow escrow = releasedEscrow(project, 10_000);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> schedule(escrow, PlaceholderPolicy.WITHHOLD));
            assertEquals(ErrorCode.NO_RECIPIENTS, e.getErrorCode());
            assertThrows(NotFoundException.class, () -> batchService.getByEscrow(escrow.getId()));
        }

        @Test
        @DisplayName("a project without an agreement fails REVENUE_MODEL_NOT_FOUND")
        void noAgreement() {
            UUID owner = UUID.randomUUID();
            UUID projectId = projectService.createProject("No splits", owner, Set.of()).getId();
            ProjectSetup project = new ProjectSetup(projectId, owner, List.of());

            NotFoundException e = assertThrows(NotFoundException.class,
                    () -> schedule(releasedEscrow(project, 10_000), PlaceholderPolicy.WITHHOLD));
            assertEquals(ErrorCode.REVENUE_MODEL_NOT_FOUND, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Escrow terms")
    class EscrowTerms {

        @Test
        @DisplayName("an amount and currency that differ from the escrow are rejected before any batch exists")
        void inflatedAmountInOtherCurrency() {
            printTestHeader("Payout terms must match the escrow");
            Escrow escrow = releasedEscrow(fixtures.projectWithTwoRecipients(), 10_000);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> scheduler.schedulePayouts(escrow.getId(), escrow.getProjectId(), escrow.getMilestoneId(),
                            1_000_000, CurrencyCode.EUR, PlaceholderPolicy.WITHHOLD));

            assertEquals(ErrorCode.ESCROW_MISMATCH, e.getErrorCode());
            assertTrue(e.getMessage().contains("amount"));
            assertTrue(e.getMessage().contains("currency"));
            assertThrows(NotFoundException.class, () -> batchService.getByEscrow(escrow.getId()));

            PayoutBatch batch = schedule(escrow, PlaceholderPolicy.WITHHOLD);
            assertEquals(9_500, batch.getTotalNet());
            printSuccess("1,000,000 EUR refused for a 10,000 USD escrow; the correct terms still schedule");
        }

        @Test
        @DisplayName("another project's id cannot pay out this escrow")
        void foreignProject() {
            Escrow escrow = releasedEscrow(fixtures.projectWithTwoRecipients(), 10_000);
            ProjectSetup other = fixtures.projectWithTwoRecipients();

            ValidationException e = assertThrows(ValidationException.class,
                    () -> scheduler.schedulePayouts(escrow.getId(), other.getProjectId(), escrow.getMilestoneId(),
                            escrow.getAmount(), escrow.getCurrency(), PlaceholderPolicy.WITHHOLD));
            assertEquals(ErrorCode.ESCROW_MISMATCH, e.getErrorCode());
            assertThrows(NotFoundException.class, () -> batchService.getByEscrow(escrow.getId()));
        }
    }
}
