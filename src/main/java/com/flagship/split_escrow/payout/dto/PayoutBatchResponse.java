package com.flagship.split_escrow.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.payout.PayoutBatch;
import com.flagship.split_escrow.payout.PayoutItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PayoutBatchResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("escrow_id")
    UUID escrowId;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("milestone_id")
    UUID milestoneId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("gross_amount")
    long grossAmount;

    @JsonProperty("platform_fee")
    long platformFee;

    @JsonProperty("total_net")
    long totalNet;

    @JsonProperty("withheld_amount")
    long withheldAmount;

    @JsonProperty("placeholder_policy")
    String placeholderPolicy;

    @JsonProperty("status")
    String status;

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class Item {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("recipient_id")
        UUID recipientId;

        @JsonProperty("percentage")
        BigDecimal percentage;

        @JsonProperty("gross_share")
        long grossShare;

        @JsonProperty("platform_fee_share")
        long platformFeeShare;

        @JsonProperty("net_amount")
        long netAmount;

        @JsonProperty("status")
        String status;

        @JsonProperty("attempts")
        int attempts;

        @JsonProperty("provider_transfer_id")
        String providerTransferId;

        @JsonProperty("failure_reason")
        String failureReason;

        static Item from(PayoutItem item) {
            return new Item(item.getId(), item.getRecipientId(), item.getPercentage(), item.getGrossShare(),
                    item.getPlatformFeeShare(), item.getNetAmount(), item.getStatus().name(), item.getAttempts(),
                    item.getProviderTransferId(), item.getFailureReason());
        }
    }

    public static PayoutBatchResponse from(PayoutBatch batch) {
        return PayoutBatchResponse.builder()
                .id(batch.getId())
                .escrowId(batch.getEscrowId())
                .projectId(batch.getProjectId())
                .milestoneId(batch.getMilestoneId())
                .currency(batch.getCurrency().name())
                .grossAmount(batch.getGrossAmount())
                .platformFee(batch.getPlatformFee())
                .totalNet(batch.getTotalNet())
                .withheldAmount(batch.getWithheldAmount())
                .placeholderPolicy(batch.getPlaceholderPolicy().name())
                .status(batch.getStatus().name())
                .jobId(batch.getJobId())
                .items(batch.getItems().stream().map(Item::from).toList())
                .createdAt(batch.getCreatedAt())
                .build();
    }
}
