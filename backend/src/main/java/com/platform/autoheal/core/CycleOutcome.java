package com.platform.autoheal.core;

/**
 * How a single evaluation cycle ended.
 */
public enum CycleOutcome {
    /** Risk LOW and nothing to undo. */
    NO_ACTION,
    /** Next tier performed and committed. */
    ESCALATED,
    /** Risk LOW after an episode; counter reset. */
    RECOVERED,
    /** Risk HIGH with every tier used. */
    EXHAUSTED,
    /** Another writer changed the state first; decision discarded. */
    CONFLICT,
    /** Another cycle holds a live claim on this workload. */
    IN_FLIGHT,
    /** Remediation failed; claim released, same tier next cycle. */
    ACTUATOR_FAILED,
    /** Signals could not be read; state untouched. */
    METRICS_UNAVAILABLE,
    /** The control plane may not act on the workload. */
    PERMISSION_DENIED,
    /** Action applied but the commit failed; the claim expires and the tier is re-issued. */
    STATE_NOT_RECORDED
}
