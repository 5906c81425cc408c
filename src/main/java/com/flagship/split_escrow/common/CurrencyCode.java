package com.flagship.split_escrow.common;

import java.util.Locale;

/**
 * ISO-4217 currency codes accepted by the settlement engine.
 *
 * Amounts are always carried in the currency's minor unit (cents, paise, ...).
 * Conversion between currencies is not supported.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    INR,
    JPY;

    /**
     * Parses a three-letter code, case-insensitive.
     *
     * @throws IllegalArgumentException if the code is blank or unsupported
     */
    public static CurrencyCode fromString(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency code is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency: " + code);
        }
    }
}
