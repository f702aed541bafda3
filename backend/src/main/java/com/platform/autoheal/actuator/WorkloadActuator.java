package com.platform.autoheal.actuator;

import com.platform.autoheal.model.WorkloadRef;

/**
 * Remediation actions against a running workload.
 *
 * All calls are synchronous and safe to repeat. Implementations throw
 * {@link com.platform.autoheal.error.ActuatorException} when the platform rejects or fails the
 * action and {@link com.platform.autoheal.error.PermissionDeniedException} when the control
 * plane lacks the rights to perform it.
 */
public interface WorkloadActuator {

    /**
     * Rolling restart of every pod of the workload.
     */
    ActionResult restart(WorkloadRef workload);

    ActionResult scale(WorkloadRef workload, int replicas);

    /**
     * Clear the in-process cache of a running pod, then restart.
     */
    ActionResult clearCache(WorkloadRef workload);

    /**
     * Revert the workload to its immediately prior revision.
     */
    ActionResult rollback(WorkloadRef workload);

    /**
     * Replica count a restart should leave the workload with.
     */
    int desiredReplicas(WorkloadRef workload);
}
