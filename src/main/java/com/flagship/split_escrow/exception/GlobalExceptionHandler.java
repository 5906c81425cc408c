package com.flagship.split_escrow.exception;

import com.flagship.split_escrow.observability.CorrelationContext;
import com.flagship.split_escrow.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the settlement exception hierarchy to consistent API error bodies.
 *
 * Validation 400, signature 401, permission 403, not found 404, conflict 409.
 * Currency conservation defects and anything unexpected are 500.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final SettlementMetrics metrics;

    @ExceptionHandler(CurrencyConservationException.class)
    public ResponseEntity<ApiError> handleConservation(CurrencyConservationException e) {
        log.error("CRITICAL currency conservation violation: expected={}, actual={}",
                e.getExpected(), e.getActual(), e);
        metrics.recordConservationViolation();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode().name(),
                "Settlement aborted: internal consistency check failed", null);
    }

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<ApiError> handleSchema(SchemaValidationException e) {
        log.warn("Job payload rejected: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i < e.getFields().size(); i++) {
            details.put(e.getFields().get(i), e.getViolations().get(i));
        }
        return build(HttpStatus.BAD_REQUEST, e.getErrorCode().name(), e.getMessage(), details);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ApiError> handlePermission(PermissionDeniedException e) {
        log.warn("Permission denied: {}", e.getMessage());
        return build(HttpStatus.FORBIDDEN, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ApiError> handleSignature(InvalidSignatureException e) {
        log.warn("Rejected webhook: {}", e.getMessage());
        return build(HttpStatus.UNAUTHORIZED, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        log.warn("Concurrent modification detected: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, ErrorCode.CONCURRENT_MODIFICATION.name(),
                "The resource was modified concurrently, retry the request", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return build(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));

        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be parsed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, ErrorCode.INVALID_TRANSITION.name(), e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, String message,
                                           Map<String, String> details) {
        ApiError body = ApiError.builder()
                .error(error)
                .message(message)
                .details(details)
                .correlationId(CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
