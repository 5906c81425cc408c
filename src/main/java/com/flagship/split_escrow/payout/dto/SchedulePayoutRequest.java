package com.flagship.split_escrow.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePayoutRequest {

    @NotNull(message = "escrow_id is required")
    @JsonProperty("escrow_id")
    private UUID escrowId;

    @NotNull(message = "project_id is required")
    @JsonProperty("project_id")
    private UUID projectId;

    @JsonProperty("milestone_id")
    private UUID milestoneId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    @NotBlank(message = "Currency is required")
    private String currency;

    /**
     * WITHHOLD or RENORMALIZE; the configured default when absent.
     */
    @JsonProperty("placeholder_policy")
    private String placeholderPolicy;
}
