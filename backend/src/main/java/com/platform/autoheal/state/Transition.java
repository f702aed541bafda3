package com.platform.autoheal.state;

/**
 * Result of applying a risk label to a phase.
 */
public record Transition(HealingPhase from, HealingPhase to, Kind kind) {

    public enum Kind {
        /** Nothing to do. */
        STAY,
        /** Perform the next tier's action. */
        ESCALATE,
        /** Risk is LOW again after an episode; reset the counter. */
        RECOVER,
        /** Ladder exhausted, wait for recovery or an operator reset. */
        EXHAUSTED
    }

    static Transition stay(HealingPhase phase) {
        return new Transition(phase, phase, Kind.STAY);
    }

    static Transition escalate(HealingPhase from, HealingPhase to) {
        return new Transition(from, to, Kind.ESCALATE);
    }

    static Transition recover(HealingPhase from) {
        return new Transition(from, HealingPhase.HEALTHY, Kind.RECOVER);
    }

    static Transition exhausted(HealingPhase phase) {
        return new Transition(phase, phase, Kind.EXHAUSTED);
    }

    /**
     * The remediation tier to execute, or NONE when this transition does not act.
     */
    public HealingAction action() {
        return kind == Kind.ESCALATE ? to.lastAction() : HealingAction.NONE;
    }
}
