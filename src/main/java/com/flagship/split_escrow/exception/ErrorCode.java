package com.flagship.split_escrow.exception;

/**
 * Stable error identifiers surfaced to callers in {@link ApiError#getError()}.
 */
public enum ErrorCode {
    // validation
    INVALID_AMOUNT,
    PERCENTAGE_MODEL_REQUIRED,
    SPLIT_SUM_INVALID,
    NO_RECIPIENTS,
    CORRELATION_MISSING,
    INVALID_WEBHOOK_PAYLOAD,
    PROVIDER_REFERENCE_MISMATCH,
    SCHEMA_VALIDATION_FAILED,
    ESCROW_MISMATCH,

    // conflict
    ESCROW_ALREADY_ACTIVE,
    ALREADY_SCHEDULED,
    ALREADY_PROCESSED,
    NOT_FUNDED,
    INVALID_TRANSITION,
    CONCURRENT_MODIFICATION,

    // not found
    PROJECT_NOT_FOUND,
    MILESTONE_NOT_FOUND,
    ESCROW_NOT_FOUND,
    BATCH_NOT_FOUND,
    TRANSACTION_NOT_FOUND,
    REVENUE_MODEL_NOT_FOUND,
    JOB_NOT_FOUND,
    JOB_TYPE_NOT_FOUND,
    PROVIDER_NOT_FOUND,

    // access
    PERMISSION_DENIED,
    INVALID_SIGNATURE,

    // fatal
    CURRENCY_CONSERVATION_VIOLATED
}
