package com.flagship.split_escrow.escrow;

/**
 * Escrow lifecycle.
 *
 * <pre>
 * LOCKED --hold--> HELD --resume--> LOCKED
 * LOCKED --release--> RELEASED (terminal)
 * LOCKED|HELD --refund--> REFUNDED (terminal)
 * </pre>
 */
public enum EscrowStatus {
    LOCKED,
    HELD,
    RELEASED,
    REFUNDED;

    public boolean isActive() {
        return this == LOCKED || this == HELD;
    }

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED;
    }
}
