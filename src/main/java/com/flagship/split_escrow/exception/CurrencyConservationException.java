package com.flagship.split_escrow.exception;

import lombok.Getter;

/**
 * Raised when distributed amounts do not add up to the amount being distributed.
 *
 * This is a programming defect, never a user error. It must abort the
 * surrounding transaction and is always reported as a server error.
 */
@Getter
public class CurrencyConservationException extends SettlementException {

    private final long expected;
    private final long actual;

    public CurrencyConservationException(long expected, long actual) {
        super(ErrorCode.CURRENCY_CONSERVATION_VIOLATED,
                String.format("Currency conservation violated: expected %d minor units, distributed %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
