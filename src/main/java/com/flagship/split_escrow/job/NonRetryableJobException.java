package com.flagship.split_escrow.job;

/**
 * Signals that retrying the job cannot succeed.
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }
}
