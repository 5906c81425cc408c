package com.flagship.split_escrow.milestone.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.milestone.ApprovalResult;
import com.flagship.split_escrow.milestone.Milestone;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MilestoneResponse {

    @JsonProperty("milestone_id")
    UUID milestoneId;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("title")
    String title;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    String status;

    @JsonProperty("escrow_id")
    UUID escrowId;

    @JsonProperty("dispute_reason")
    String disputeReason;

    @JsonProperty("payout_batch_id")
    UUID payoutBatchId;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MilestoneResponse from(Milestone milestone) {
        return base(milestone).build();
    }

    public static MilestoneResponse from(ApprovalResult result) {
        return base(result.getMilestone())
                .payoutBatchId(result.getPayoutBatch().getId())
                .build();
    }

    private static MilestoneResponseBuilder base(Milestone milestone) {
        return MilestoneResponse.builder()
                .milestoneId(milestone.getId())
                .projectId(milestone.getProjectId())
                .title(milestone.getTitle())
                .amount(milestone.getAmount())
                .currency(milestone.getCurrency().name())
                .status(milestone.getStatus().name())
                .escrowId(milestone.getEscrowId())
                .disputeReason(milestone.getDisputeReason())
                .updatedAt(milestone.getUpdatedAt());
    }
}
