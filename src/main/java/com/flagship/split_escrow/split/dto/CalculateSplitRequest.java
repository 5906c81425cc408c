package com.flagship.split_escrow.split.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Either {@code splits} or {@code projectId} must be provided.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalculateSplitRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    @NotBlank(message = "Currency is required")
    private String currency;

    @JsonProperty("project_id")
    private UUID projectId;

    @Valid
    private List<SplitEntryRequest> splits;
}
