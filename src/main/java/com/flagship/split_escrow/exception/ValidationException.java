package com.flagship.split_escrow.exception;

/**
 * Malformed input: bad percentages, non-conserving splits, missing correlation data.
 */
public class ValidationException extends SettlementException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
