package com.flagship.split_escrow.payment.psp;

/**
 * Provider-reported outcome of a money movement.
 */
public enum PspStatus {
    SUCCEEDED,
    PENDING,
    FAILED
}
