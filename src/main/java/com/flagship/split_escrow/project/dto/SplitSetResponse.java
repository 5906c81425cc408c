package com.flagship.split_escrow.project.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.split.RevenueSplit;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class SplitSetResponse {

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("splits")
    List<Entry> splits;

    @Value
    public static class Entry {
        @JsonProperty("recipient_id")
        UUID recipientId;

        @JsonProperty("placeholder_label")
        String placeholderLabel;

        @JsonProperty("percentage")
        BigDecimal percentage;

        @JsonProperty("fixed_amount")
        Long fixedAmount;
    }

    public static SplitSetResponse from(UUID projectId, List<RevenueSplit> splits) {
        return new SplitSetResponse(projectId, splits.stream()
                .map(split -> new Entry(split.getRecipientId(), split.getPlaceholderLabel(),
                        split.getPercentage(), split.getFixedAmount()))
                .toList());
    }
}
