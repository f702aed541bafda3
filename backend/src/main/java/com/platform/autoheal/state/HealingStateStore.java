package com.platform.autoheal.state;

import com.platform.autoheal.model.WorkloadRef;

/**
 * Durable, versioned healing state keyed by workload identity.
 *
 * Writes are compare-and-set on {@link HealingState#versionToken()}: there are no locks, and a
 * writer that lost a race learns about it through
 * {@link com.platform.autoheal.error.StateConflictException}.
 */
public interface HealingStateStore {

    /**
     * Read the current state; a workload never written before yields {@link HealingState#initial}.
     */
    HealingState read(WorkloadRef workload);

    /**
     * Store {@code next} iff the stored token still equals {@code expected.versionToken()}.
     *
     * @return the stored state, carrying its new version token
     * @throws com.platform.autoheal.error.StateConflictException if the token moved on
     */
    HealingState compareAndSet(HealingState expected, HealingState next);
}
