package com.flagship.split_escrow.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.job.Job;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class JobResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    String type;

    @JsonProperty("status")
    String status;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("attempt")
    int attempt;

    @JsonProperty("max_attempts")
    int maxAttempts;

    @JsonProperty("next_run_at")
    Instant nextRunAt;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("result")
    String result;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
                .id(job.getId())
                .type(job.getType())
                .status(job.getStatus().name())
                .priority(job.getPriority())
                .attempt(job.getAttempt())
                .maxAttempts(job.getMaxAttempts())
                .nextRunAt(job.getNextRunAt())
                .lastError(job.getLastError())
                .result(job.getResult())
                .payload(job.getPayload())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
