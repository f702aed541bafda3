package com.platform.autoheal.error;

import com.platform.autoheal.observability.LoggingConfig;
import com.platform.autoheal.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 *
 * Converts exceptions to the standard ErrorResponse, logs them with a severity that matches
 * their category and counts them by error code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    // ==================== Auto-heal Exceptions ====================

    @ExceptionHandler(AutoHealException.class)
    public ResponseEntity<ErrorResponse> handleAutoHealException(
            AutoHealException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);

        return ResponseEntity.status(status).body(baseResponse(errorCode, ex.getMessage(), status, request, traceId)
            .fatal(ex.isFatal())
            .build());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Resource not found: {} ({})", traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse.ErrorResponseBuilder builder =
            baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, traceId);

        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }

        return ResponseEntity.badRequest().body(builder.build());
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<ErrorResponse> handleStateConflict(
            StateConflictException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.info("[{}] Healing state conflict on {}: {}", traceId, ex.getWorkload(), ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.CONFLICT, request, traceId)
            .detail("Healing state was modified by another cycle. Please retry.")
            .metadata(Map.of(
                "workload", String.valueOf(ex.getWorkload()),
                "expectedVersion", String.valueOf(ex.getExpectedToken()),
                "actualVersion", String.valueOf(ex.getActualToken())
            ))
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(
            PermissionDeniedException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] FATAL: permission denied for {} on {}: {}",
            traceId, ex.getOperation(), ex.getWorkload(), ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.FORBIDDEN, request, traceId)
            .fatal(true)
            .metadata(Map.of(
                "workload", String.valueOf(ex.getWorkload()),
                "operation", String.valueOf(ex.getOperation())
            ))
            .build();

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST, "Invalid request body",
                HttpStatus.BAD_REQUEST, request, traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);

        ErrorResponse response = baseResponse(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST, request, traceId)
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED, request, traceId)
            .build();

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);

        ErrorResponse response = baseResponse(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .fatal(true)
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Helpers ====================

    private ErrorResponse.ErrorResponseBuilder baseResponse(ErrorCode errorCode, String message, HttpStatus status,
                                                            HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put(LoggingConfig.MDC_CORRELATION_ID, traceId);
        }
        return traceId;
    }

    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("autoheal.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case WORKLOAD_NOT_FOUND, WORKLOAD_NOT_MANAGED -> HttpStatus.NOT_FOUND;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, INVALID_FIELD_VALUE -> HttpStatus.BAD_REQUEST;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case METRICS_UNAVAILABLE, PREDICTOR_UNAVAILABLE, KUBERNETES_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case ACTUATOR_FAILED, ROLLOUT_TIMEOUT, NO_PREVIOUS_REVISION, CACHE_CLEAR_FAILED -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
