package com.flagship.split_escrow.split;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Per-recipient line of a {@link SplitBreakdown}.
 *
 * {@code grossShare} and {@code platformFeeShare} are informational
 * attributions. Only {@code netAmount} is paid out.
 */
@Value
public class RecipientShare {
    int position;
    UUID recipientId;
    String placeholderLabel;
    BigDecimal percentage;
    long grossShare;
    long platformFeeShare;
    long taxWithheld;
    long netAmount;

    public boolean isPlaceholder() {
        return recipientId == null;
    }
}
