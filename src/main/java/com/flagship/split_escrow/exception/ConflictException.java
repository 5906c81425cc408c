package com.flagship.split_escrow.exception;

/**
 * A conditional mutation was rejected because the aggregate is not in a state
 * that allows it (duplicate escrow lock, duplicate payout schedule, repeated
 * milestone transition, ...).
 */
public class ConflictException extends SettlementException {

    public ConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConflictException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
