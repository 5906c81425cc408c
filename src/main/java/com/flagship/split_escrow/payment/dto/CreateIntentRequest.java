package com.flagship.split_escrow.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateIntentRequest {

    @NotNull(message = "payer_id is required")
    @JsonProperty("payer_id")
    private UUID payerId;

    @JsonProperty("project_id")
    private UUID projectId;

    @NotNull(message = "milestone_id is required")
    @JsonProperty("milestone_id")
    private UUID milestoneId;

    @Positive(message = "Amount must be positive")
    private Long amount;

    private String currency;

    private String provider;
}
