package com.platform.autoheal.error;

import com.platform.autoheal.model.WorkloadRef;

/**
 * A conditional write to the healing state was rejected because the stored version token
 * no longer matches the one the writer read.
 */
public class StateConflictException extends AutoHealException {

    private final WorkloadRef workload;
    private final String expectedToken;
    private final String actualToken;

    public StateConflictException(WorkloadRef workload, String expectedToken, String actualToken) {
        super(ErrorCode.STATE_CONFLICT, String.format(
            "Healing state of %s changed concurrently (expected version %s, found %s)",
            workload, expectedToken, actualToken));
        this.workload = workload;
        this.expectedToken = expectedToken;
        this.actualToken = actualToken;
    }

    public WorkloadRef getWorkload() {
        return workload;
    }

    public String getExpectedToken() {
        return expectedToken;
    }

    public String getActualToken() {
        return actualToken;
    }
}
