package com.flagship.split_escrow.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueJobRequest {

    @NotBlank(message = "Job type is required")
    @JsonProperty("type")
    private String type;

    @JsonProperty("payload")
    private Map<String, Object> payload;

    @JsonProperty("priority")
    private Integer priority;

    @JsonProperty("run_at")
    private Instant runAt;

    @Min(value = 1, message = "max_attempts must be at least 1")
    @JsonProperty("max_attempts")
    private Integer maxAttempts;
}
