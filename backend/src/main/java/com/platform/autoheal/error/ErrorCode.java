package com.platform.autoheal.error;

/**
 * Standardized error codes for the auto-heal control plane.
 * Each error has a unique code that clients and alerting rules can match on.
 *
 * Format: AH-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Authorization errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Collaborator errors (metrics backend, inference service, webhook, Kubernetes API)
 * - 5xx: Healing domain errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("AH-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("AH-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("AH-103", "Invalid field value", ErrorCategory.RECOVERABLE),

    // ==================== Auth Errors (2xx) ====================

    PERMISSION_DENIED("AH-201", "Not permitted to mutate workload", ErrorCategory.FATAL),

    // ==================== Resource Errors (3xx) ====================

    WORKLOAD_NOT_FOUND("AH-300", "Workload not found", ErrorCategory.RECOVERABLE),
    WORKLOAD_NOT_MANAGED("AH-301", "Workload is not managed by auto-heal", ErrorCategory.RECOVERABLE),
    STATE_CONFLICT("AH-312", "Healing state was modified concurrently", ErrorCategory.RECOVERABLE),

    // ==================== Collaborator Errors (4xx) ====================

    METRICS_UNAVAILABLE("AH-400", "Metrics backend unavailable", ErrorCategory.RECOVERABLE),
    PREDICTOR_UNAVAILABLE("AH-410", "Inference service unavailable", ErrorCategory.RECOVERABLE),
    KUBERNETES_ERROR("AH-430", "Kubernetes API error", ErrorCategory.RECOVERABLE),

    // ==================== Healing Errors (5xx - Domain) ====================

    ACTUATOR_FAILED("AH-500", "Remediation action failed", ErrorCategory.RECOVERABLE),
    ROLLOUT_TIMEOUT("AH-501", "Rollout did not complete in time", ErrorCategory.RECOVERABLE),
    NO_PREVIOUS_REVISION("AH-502", "No previous revision to roll back to", ErrorCategory.RECOVERABLE),
    CACHE_CLEAR_FAILED("AH-503", "In-pod cache clear failed", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    UNEXPECTED_ERROR("AH-901", "Unexpected error occurred", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the next cycle may succeed without intervention.
         */
        RECOVERABLE,

        /**
         * Fatal errors - healing cannot proceed until an operator intervenes.
         */
        FATAL
    }
}
