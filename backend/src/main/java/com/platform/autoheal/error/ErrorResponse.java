package com.platform.autoheal.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every failing API call.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique error code (e.g., AH-312).
     */
    private String code;

    private String message;

    private String detail;

    /**
     * Whether the error needs operator intervention.
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    /**
     * Correlation id, matches the one in the logs.
     */
    private String traceId;

    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
