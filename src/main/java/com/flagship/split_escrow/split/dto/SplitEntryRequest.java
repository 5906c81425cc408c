package com.flagship.split_escrow.split.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.split.RevenueSplit;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitEntryRequest {

    @JsonProperty("recipient_id")
    private UUID recipientId;

    @JsonProperty("placeholder_label")
    private String placeholderLabel;

    @DecimalMin(value = "0", message = "Percentage must not be negative")
    @DecimalMax(value = "100", message = "Percentage must not exceed 100")
    private BigDecimal percentage;

    @JsonProperty("fixed_amount")
    private Long fixedAmount;

    public RevenueSplit toDomain() {
        return RevenueSplit.builder()
                .recipientId(recipientId)
                .placeholderLabel(placeholderLabel)
                .percentage(percentage)
                .fixedAmount(fixedAmount)
                .build();
    }
}
