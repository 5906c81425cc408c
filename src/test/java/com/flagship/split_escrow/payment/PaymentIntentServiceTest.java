package com.flagship.split_escrow.payment;

import com.flagship.split_escrow.SettlementFixtures;
import com.flagship.split_escrow.SettlementFixtures.ProjectSetup;
import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.exception.ConflictException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.exception.ValidationException;
import com.flagship.split_escrow.milestone.Milestone;
import com.flagship.split_escrow.milestone.MilestoneStateMachine;
import com.flagship.split_escrow.payment.psp.SandboxPspGateway;
import com.flagship.split_escrow.project.ProjectService;
import com.flagship.split_escrow.split.RevenueSplitService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment intents are created for the milestone's own amount and recorded
 * before the payer is sent to the provider.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Payment Intent Tests")
class PaymentIntentServiceTest {

    @Autowired
    private PaymentIntentService intentService;

    @Autowired
    private MilestoneStateMachine stateMachine;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private RevenueSplitService splitService;

    private SettlementFixtures fixtures;
    private ProjectSetup project;

    @BeforeEach
    void setUp() {
        fixtures = new SettlementFixtures(projectService, splitService, stateMachine);
        project = fixtures.projectWithTwoRecipients();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("an intent takes amount and currency from the milestone")
    void createsIntentFromMilestone() {
        printTestHeader("Create intent");
        Milestone milestone = fixtures.milestone(project, 25_000);
        UUID payer = UUID.randomUUID();

        PaymentIntentService.IntentCreated created =
                intentService.createIntent(payer, null, milestone.getId(), null, null, null);

        PaymentTransaction transaction = created.getTransaction();
        assertEquals(TransactionStatus.CREATED, transaction.getStatus());
        assertEquals(25_000, transaction.getAmount());
        assertEquals(CurrencyCode.USD, transaction.getCurrency());
        assertEquals(project.getProjectId(), transaction.getProjectId());
        assertEquals(SandboxPspGateway.PROVIDER, transaction.getProvider());
        assertTrue(transaction.getProviderIntentId().startsWith("sbx_pi_"));
        assertEquals(transaction.getProviderIntentId(), created.getIntent().getProviderIntentId());
        assertNotNull(created.getIntent().getClientSecret());

        assertEquals(1, intentService.transactionsForMilestone(milestone.getId()).size());
        assertEquals(transaction.getId(), intentService.getTransaction(transaction.getId()).getId());
    }

    @Test
    @DisplayName("amount, currency and project must agree with the milestone")
    void rejectsMismatchedRequests() {
        Milestone milestone = fixtures.milestone(project, 25_000);

        ValidationException amount = assertThrows(ValidationException.class, () ->
                intentService.createIntent(UUID.randomUUID(), null, milestone.getId(), 24_999L, null, null));
        assertEquals(ErrorCode.INVALID_AMOUNT, amount.getErrorCode());

        assertThrows(ValidationException.class, () ->
                intentService.createIntent(UUID.randomUUID(), null, milestone.getId(), null, CurrencyCode.EUR, null));

        NotFoundException wrongProject = assertThrows(NotFoundException.class, () ->
                intentService.createIntent(UUID.randomUUID(), UUID.randomUUID(), milestone.getId(), null, null, null));
        assertEquals(ErrorCode.MILESTONE_NOT_FOUND, wrongProject.getErrorCode());

        assertTrue(intentService.transactionsForMilestone(milestone.getId()).isEmpty());
    }

    @Test
    @DisplayName("funded milestones and unknown providers are refused")
    void refusesFundedMilestoneAndUnknownProvider() {
        Milestone funded = fixtures.fundedMilestone(project, 10_000);
        ConflictException conflict = assertThrows(ConflictException.class, () ->
                intentService.createIntent(UUID.randomUUID(), null, funded.getId(), null, null, null));
        assertEquals(ErrorCode.INVALID_TRANSITION, conflict.getErrorCode());

        Milestone pending = fixtures.milestone(project, 10_000);
        NotFoundException provider = assertThrows(NotFoundException.class, () ->
                intentService.createIntent(UUID.randomUUID(), null, pending.getId(), null, null, "acme-pay"));
        assertEquals(ErrorCode.PROVIDER_NOT_FOUND, provider.getErrorCode());
    }
}
