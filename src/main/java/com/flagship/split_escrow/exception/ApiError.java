package com.flagship.split_escrow.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
