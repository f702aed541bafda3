package com.platform.autoheal.error;

import com.platform.autoheal.model.WorkloadRef;

/**
 * The control plane's service account may not read or mutate the workload or its metadata.
 * Always fatal: healing silently stops working if this is swallowed.
 */
public class PermissionDeniedException extends AutoHealException {

    private final WorkloadRef workload;
    private final String operation;

    public PermissionDeniedException(WorkloadRef workload, String operation, Throwable cause) {
        super(ErrorCode.PERMISSION_DENIED,
            String.format("Permission denied for %s on %s: %s", operation, workload, cause.getMessage()),
            cause);
        this.workload = workload;
        this.operation = operation;
    }

    public WorkloadRef getWorkload() {
        return workload;
    }

    public String getOperation() {
        return operation;
    }
}
