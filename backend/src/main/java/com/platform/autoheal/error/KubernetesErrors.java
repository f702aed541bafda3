package com.platform.autoheal.error;

import com.platform.autoheal.model.WorkloadRef;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Maps fabric8 client failures onto the auto-heal error taxonomy.
 */
public final class KubernetesErrors {

    private KubernetesErrors() {
    }

    public static boolean isPermissionDenied(KubernetesClientException e) {
        return e.getCode() == 401 || e.getCode() == 403;
    }

    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == 409;
    }

    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == 404;
    }

    /**
     * Translate a failed state read or write.
     */
    public static AutoHealException forState(WorkloadRef workload, String operation, KubernetesClientException e) {
        if (isPermissionDenied(e)) {
            return new PermissionDeniedException(workload, operation, e);
        }
        if (isNotFound(e)) {
            return ResourceNotFoundException.workload(workload.toString());
        }
        return TransientIOException.kubernetes(
            String.format("%s failed on %s: %s", operation, workload, e.getMessage()), e);
    }

    /**
     * Translate a failed remediation call.
     */
    public static AutoHealException forAction(WorkloadRef workload, String operation, KubernetesClientException e) {
        if (isPermissionDenied(e)) {
            return new PermissionDeniedException(workload, operation, e);
        }
        return ActuatorException.failed(workload, operation, e);
    }
}
