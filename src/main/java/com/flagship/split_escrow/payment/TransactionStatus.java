package com.flagship.split_escrow.payment;

/**
 * Status of a pay-in transaction.
 *
 * CREATED once the provider intent exists, PENDING when the provider reports
 * processing, then SUCCEEDED or FAILED from a webhook. Both outcomes are
 * terminal; any later delivery for the transaction is a duplicate.
 */
public enum TransactionStatus {
    CREATED,
    PENDING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
