package com.flagship.split_escrow.exception;

import lombok.Getter;

/**
 * Base type for every business failure raised by the engine.
 *
 * Each subclass corresponds to one category of the error taxonomy and is
 * mapped to an HTTP status by {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class SettlementException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SettlementException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SettlementException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
