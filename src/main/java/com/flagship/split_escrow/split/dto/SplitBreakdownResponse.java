package com.flagship.split_escrow.split.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.split.RecipientShare;
import com.flagship.split_escrow.split.SplitBreakdown;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SplitBreakdownResponse {

    @JsonProperty("gross_amount")
    long grossAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("platform_fee")
    long platformFee;

    @JsonProperty("tax_withheld")
    long taxWithheld;

    @JsonProperty("total_distributed")
    long totalDistributed;

    @JsonProperty("breakdown")
    List<Share> breakdown;

    @Value
    public static class Share {
        @JsonProperty("recipient_id")
        UUID recipientId;

        @JsonProperty("placeholder_label")
        String placeholderLabel;

        @JsonProperty("percentage")
        BigDecimal percentage;

        @JsonProperty("gross_share")
        long grossShare;

        @JsonProperty("platform_fee_share")
        long platformFeeShare;

        @JsonProperty("tax_withheld")
        long taxWithheld;

        @JsonProperty("net_amount")
        long netAmount;

        static Share from(RecipientShare share) {
            return new Share(share.getRecipientId(), share.getPlaceholderLabel(), share.getPercentage(),
                    share.getGrossShare(), share.getPlatformFeeShare(), share.getTaxWithheld(), share.getNetAmount());
        }
    }

    public static SplitBreakdownResponse from(SplitBreakdown breakdown) {
        return SplitBreakdownResponse.builder()
                .grossAmount(breakdown.getGrossAmount())
                .currency(breakdown.getCurrency().name())
                .platformFee(breakdown.getPlatformFee())
                .taxWithheld(breakdown.getTaxWithheld())
                .totalDistributed(breakdown.getTotalDistributed())
                .breakdown(breakdown.getShares().stream().map(Share::from).toList())
                .build();
    }
}
