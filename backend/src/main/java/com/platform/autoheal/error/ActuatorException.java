package com.platform.autoheal.error;

import com.platform.autoheal.model.WorkloadRef;

/**
 * A remediation action was rejected by, or failed against, the orchestration platform.
 */
public class ActuatorException extends AutoHealException {

    private final WorkloadRef workload;
    private final String operation;

    public ActuatorException(ErrorCode errorCode, WorkloadRef workload, String operation, String message) {
        super(errorCode, message);
        this.workload = workload;
        this.operation = operation;
    }

    public ActuatorException(ErrorCode errorCode, WorkloadRef workload, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.workload = workload;
        this.operation = operation;
    }

    public static ActuatorException failed(WorkloadRef workload, String operation, Throwable cause) {
        return new ActuatorException(
            ErrorCode.ACTUATOR_FAILED,
            workload,
            operation,
            String.format("%s failed on %s: %s", operation, workload, cause.getMessage()),
            cause
        );
    }

    public static ActuatorException rolloutTimeout(WorkloadRef workload, String operation, long timeoutSeconds) {
        return new ActuatorException(
            ErrorCode.ROLLOUT_TIMEOUT,
            workload,
            operation,
            String.format("Rollout of %s did not complete within %ds after %s", workload, timeoutSeconds, operation)
        );
    }

    public WorkloadRef getWorkload() {
        return workload;
    }

    public String getOperation() {
        return operation;
    }
}
