package com.flagship.split_escrow.milestone;

/**
 * Milestone status.
 *
 * <pre>
 * PENDING --fund--> FUNDED --complete--> COMPLETED --approve--> APPROVED
 * PENDING --complete--> COMPLETED
 * PENDING|FUNDED|COMPLETED --dispute--> DISPUTED
 * DISPUTED --approve--> APPROVED
 * DISPUTED --reject--> REJECTED
 * </pre>
 *
 * APPROVED and REJECTED are terminal.
 */
public enum MilestoneStatus {
    PENDING,
    FUNDED,
    COMPLETED,
    APPROVED,
    DISPUTED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }

    public boolean canTransitionTo(MilestoneStatus target) {
        return switch (this) {
            case PENDING -> target == FUNDED || target == COMPLETED || target == DISPUTED;
            case FUNDED -> target == COMPLETED || target == DISPUTED;
            case COMPLETED -> target == APPROVED || target == DISPUTED;
            case DISPUTED -> target == APPROVED || target == REJECTED;
            case APPROVED, REJECTED -> false;
        };
    }
}
