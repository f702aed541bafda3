package com.platform.autoheal.state;

/**
 * Last remediation applied to a workload. Each action corresponds to exactly one attempt value.
 */
public enum HealingAction {
    NONE(0),
    RESTARTED(1),
    CACHE_CLEARED(2),
    ROLLED_BACK(3);

    private final int attempt;

    HealingAction(int attempt) {
        this.attempt = attempt;
    }

    public int attempt() {
        return attempt;
    }

    public static HealingAction forAttempt(int attempt) {
        for (HealingAction action : values()) {
            if (action.attempt == attempt) {
                return action;
            }
        }
        throw new IllegalArgumentException("No healing action for attempt " + attempt);
    }

    /**
     * Lenient parse used for stored markers; unknown values yield null.
     */
    public static HealingAction parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
