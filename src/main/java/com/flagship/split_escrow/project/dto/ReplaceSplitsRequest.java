package com.flagship.split_escrow.project.dto;

import com.flagship.split_escrow.split.dto.SplitEntryRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplaceSplitsRequest {

    @Valid
    @NotEmpty(message = "At least one split entry is required")
    private List<SplitEntryRequest> splits;
}
