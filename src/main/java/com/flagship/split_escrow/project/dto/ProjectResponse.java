package com.flagship.split_escrow.project.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.project.ProjectEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class ProjectResponse {

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("name")
    String name;

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("member_ids")
    Set<UUID> memberIds;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ProjectResponse from(ProjectEntity project) {
        return ProjectResponse.builder()
                .projectId(project.getId())
                .name(project.getName())
                .ownerId(project.getOwnerId())
                .memberIds(Set.copyOf(project.getMemberIds()))
                .createdAt(project.getCreatedAt())
                .build();
    }
}
