package com.flagship.split_escrow.project.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateProjectRequest {

    @NotBlank(message = "Project name is required")
    private String name;

    @NotNull(message = "Owner ID is required")
    @JsonProperty("owner_id")
    private UUID ownerId;

    @JsonProperty("member_ids")
    private Set<UUID> memberIds;
}
