package com.platform.autoheal.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.autoheal.state.HealingAction;
import com.platform.autoheal.state.HealingPhase;
import com.platform.autoheal.state.HealingState;

import java.time.Duration;
import java.time.Instant;

/**
 * Read view of a workload's healing state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkloadStatus(
    String workload,
    HealingPhase phase,
    int attempt,
    HealingAction lastAction,
    Instant lastUpdated,
    String version,
    InFlight inFlight
) {

    public record InFlight(HealingAction action, Instant claimedAt, boolean expired) {
    }

    public static WorkloadStatus of(HealingState state, Instant now, Duration claimTtl) {
        InFlight inFlight = state.inFlight() == null ? null : new InFlight(
            state.inFlight().action(),
            state.inFlight().claimedAt(),
            state.inFlight().isExpired(now, claimTtl));
        return new WorkloadStatus(
            state.workload().toString(),
            state.phase(),
            state.attempt(),
            state.lastAction(),
            state.lastUpdated(),
            state.versionToken(),
            inFlight);
    }
}
