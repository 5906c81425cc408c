package com.flagship.split_escrow.split;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One entry of a revenue-split agreement.
 *
 * An entry either names a resolvable recipient or carries only a placeholder
 * label for a seat that has not been filled yet. The fixed-amount variant is
 * stored but ignored by {@link SplitCalculator}.
 */
@Value
@Builder
public class RevenueSplit {
    UUID recipientId;
    String placeholderLabel;
    BigDecimal percentage;
    Long fixedAmount;

    public static RevenueSplit ofRecipient(UUID recipientId, String percentage) {
        return RevenueSplit.builder()
                .recipientId(recipientId)
                .percentage(new BigDecimal(percentage))
                .build();
    }

    public static RevenueSplit ofPlaceholder(String label, String percentage) {
        return RevenueSplit.builder()
                .placeholderLabel(label)
                .percentage(new BigDecimal(percentage))
                .build();
    }

    public boolean isPlaceholder() {
        return recipientId == null;
    }

    public boolean hasPercentage() {
        return percentage != null;
    }

    /**
     * Copy of this entry with a different percentage, used when rescaling.
     */
    public RevenueSplit withPercentage(BigDecimal newPercentage) {
        return new RevenueSplit(recipientId, placeholderLabel, newPercentage, fixedAmount);
    }
}
