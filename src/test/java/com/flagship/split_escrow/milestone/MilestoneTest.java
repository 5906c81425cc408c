package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.common.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MilestoneTest {

    private static Milestone pending() {
        return Milestone.create(UUID.randomUUID(), "Mix and master", 10_000, CurrencyCode.USD);
    }

    @Test
    @DisplayName("happy path PENDING -> FUNDED -> COMPLETED -> APPROVED")
    void happyPath() {
        UUID escrowId = UUID.randomUUID();

        Milestone funded = pending().fund(escrowId);
        assertEquals(MilestoneStatus.FUNDED, funded.getStatus());
        assertEquals(escrowId, funded.getEscrowId());

        Milestone approved = funded.complete().approve();
        assertEquals(MilestoneStatus.APPROVED, approved.getStatus());
        assertEquals(escrowId, approved.getEscrowId());
        assertTrue(approved.getStatus().isTerminal());
    }

    @Test
    @DisplayName("disputes keep the reason and resolve to APPROVED or REJECTED")
    void disputeResolution() {
        Milestone disputed = pending().fund(UUID.randomUUID()).dispute("late delivery");

        assertEquals("late delivery", disputed.getDisputeReason());
        assertEquals(MilestoneStatus.REJECTED, disputed.reject().getStatus());
        assertEquals(MilestoneStatus.APPROVED, disputed.approve().getStatus());
    }

    @Test
    @DisplayName("illegal transitions are rejected")
    void illegalTransitions() {
        Milestone milestone = pending();

        assertThrows(IllegalStateException.class, milestone::approve);
        assertThrows(IllegalStateException.class, milestone::reject);

        Milestone funded = milestone.fund(UUID.randomUUID());
        assertThrows(IllegalStateException.class, () -> funded.fund(UUID.randomUUID()));
        assertThrows(IllegalStateException.class, funded::approve);
    }

    @ParameterizedTest
    @EnumSource(value = MilestoneStatus.class, names = {"APPROVED", "REJECTED"})
    @DisplayName("terminal statuses allow no transition")
    void terminalStatuses(MilestoneStatus terminal) {
        for (MilestoneStatus target : MilestoneStatus.values()) {
            assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
        }
    }

    @Test
    @DisplayName("amount must be positive")
    void positiveAmount() {
        assertThrows(IllegalArgumentException.class,
                () -> Milestone.create(UUID.randomUUID(), "x", 0, CurrencyCode.USD));
    }
}
