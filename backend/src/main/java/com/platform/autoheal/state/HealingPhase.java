package com.platform.autoheal.state;

import com.platform.autoheal.model.RiskLabel;

/**
 * The escalation ladder. Every workload is in exactly one phase, derived from its attempt counter.
 *
 * <pre>
 * HEALTHY --HIGH--> ESCALATING_1 --HIGH--> ESCALATING_2 --HIGH--> ROLLED_BACK --HIGH--> ROLLED_BACK
 *    ^                   |                      |                      |
 *    +-------LOW---------+----------LOW---------+----------LOW---------+
 * </pre>
 */
public enum HealingPhase {
    HEALTHY(0),
    ESCALATING_1(1),
    ESCALATING_2(2),
    ROLLED_BACK(3);

    public static final int MAX_ATTEMPT = 3;

    private final int attempt;

    HealingPhase(int attempt) {
        this.attempt = attempt;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * Action recorded once this phase has been reached.
     */
    public HealingAction lastAction() {
        return HealingAction.forAttempt(attempt);
    }

    public static HealingPhase fromAttempt(int attempt) {
        if (attempt < 0 || attempt > MAX_ATTEMPT) {
            throw new IllegalArgumentException("Attempt out of range: " + attempt);
        }
        return values()[attempt];
    }

    /**
     * The single transition function of the ladder. Escalation always moves exactly one rung;
     * the only way down is recovery to HEALTHY.
     */
    public Transition next(RiskLabel risk) {
        if (risk == RiskLabel.LOW) {
            return this == HEALTHY ? Transition.stay(this) : Transition.recover(this);
        }
        return switch (this) {
            case HEALTHY -> Transition.escalate(this, ESCALATING_1);
            case ESCALATING_1 -> Transition.escalate(this, ESCALATING_2);
            case ESCALATING_2 -> Transition.escalate(this, ROLLED_BACK);
            case ROLLED_BACK -> Transition.exhausted(this);
        };
    }
}
