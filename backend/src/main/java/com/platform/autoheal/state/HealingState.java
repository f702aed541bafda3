package com.platform.autoheal.state;

import com.platform.autoheal.model.WorkloadRef;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Escalation progress of one workload, as read from or written to a {@link HealingStateStore}.
 *
 * @param workload     managed workload
 * @param attempt      0..3, the number of tiers applied in the current episode
 * @param lastAction   always {@code HealingAction.forAttempt(attempt)}
 * @param lastUpdated  time of the last write, null if never written
 * @param versionToken opaque token that changes on every write
 * @param inFlight     claim of a tier that has been decided but not committed, or null
 */
public record HealingState(
    WorkloadRef workload,
    int attempt,
    HealingAction lastAction,
    Instant lastUpdated,
    String versionToken,
    InFlightClaim inFlight
) {

    public static final String INITIAL_TOKEN = "0";

    public HealingState {
        Objects.requireNonNull(workload, "workload");
        Objects.requireNonNull(versionToken, "versionToken");
        if (attempt < 0 || attempt > HealingPhase.MAX_ATTEMPT) {
            throw new IllegalArgumentException("attempt must be within 0.." + HealingPhase.MAX_ATTEMPT + ": " + attempt);
        }
        if (lastAction != HealingAction.forAttempt(attempt)) {
            throw new IllegalArgumentException("lastAction " + lastAction + " inconsistent with attempt " + attempt);
        }
    }

    /**
     * State of a workload that has never been evaluated.
     */
    public static HealingState initial(WorkloadRef workload) {
        return new HealingState(workload, 0, HealingAction.NONE, null, INITIAL_TOKEN, null);
    }

    /**
     * Builds a state from stored values that may have been edited by hand: the attempt is
     * clamped into range and the last action derived from it.
     */
    public static HealingState normalized(WorkloadRef workload, int rawAttempt, Instant lastUpdated,
                                          String versionToken, InFlightClaim inFlight) {
        int attempt = Math.max(0, Math.min(HealingPhase.MAX_ATTEMPT, rawAttempt));
        return new HealingState(workload, attempt, HealingAction.forAttempt(attempt), lastUpdated,
            versionToken != null ? versionToken : INITIAL_TOKEN, inFlight);
    }

    public HealingPhase phase() {
        return HealingPhase.fromAttempt(attempt);
    }

    public boolean hasClaim() {
        return inFlight != null;
    }

    public boolean hasLiveClaim(Instant now, Duration ttl) {
        return inFlight != null && !inFlight.isExpired(now, ttl);
    }

    /**
     * Same progress, plus a claim on the given tier.
     */
    public HealingState claim(HealingAction action, Instant now) {
        return new HealingState(workload, attempt, lastAction, now, versionToken, new InFlightClaim(action, now));
    }

    /**
     * Progress moved to the given phase, claim cleared.
     */
    public HealingState advanceTo(HealingPhase phase, Instant now) {
        return new HealingState(workload, phase.attempt(), phase.lastAction(), now, versionToken, null);
    }

    /**
     * Claim dropped without progress.
     */
    public HealingState release(Instant now) {
        return new HealingState(workload, attempt, lastAction, now, versionToken, null);
    }

    public HealingState reset(Instant now) {
        return advanceTo(HealingPhase.HEALTHY, now);
    }

    public HealingState withVersionToken(String token) {
        return new HealingState(workload, attempt, lastAction, lastUpdated, token, inFlight);
    }
}
