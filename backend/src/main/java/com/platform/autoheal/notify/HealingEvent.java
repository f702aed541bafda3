package com.platform.autoheal.notify;

import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.state.HealingAction;

/**
 * A human-readable alert about a healing decision.
 */
public record HealingEvent(Type type, WorkloadRef workload, String text) {

    public enum Type {
        ESCALATION,
        ROLLBACK,
        RECOVERY,
        EXHAUSTED,
        PERMISSION_DENIED
    }

    public static HealingEvent escalation(WorkloadRef workload, HealingAction action, RiskAssessment risk) {
        if (action == HealingAction.ROLLED_BACK) {
            return new HealingEvent(Type.ROLLBACK, workload, String.format(
                ":rewind: *Rollback triggered* for deployment `%s` (failure probability %.2f%s). "
                    + "Further HIGH risk will need manual intervention.",
                workload, risk.probability(), degradedSuffix(risk)));
        }
        return new HealingEvent(Type.ESCALATION, workload, String.format(
            ":warning: *Auto-heal tier %d (%s)* applied to deployment `%s` (failure probability %.2f%s).",
            action.attempt(), action, workload, risk.probability(), degradedSuffix(risk)));
    }

    public static HealingEvent recovery(WorkloadRef workload, int previousAttempt, RiskAssessment risk) {
        return new HealingEvent(Type.RECOVERY, workload, String.format(
            ":white_check_mark: *Recovered*: deployment `%s` is back to LOW risk (probability %.2f) after %d healing attempt(s).",
            workload, risk.probability(), previousAttempt));
    }

    public static HealingEvent exhausted(WorkloadRef workload, RiskAssessment risk) {
        return new HealingEvent(Type.EXHAUSTED, workload, String.format(
            ":rotating_light: *Auto-healing failed* for deployment `%s` after %d attempts "
                + "(failure probability %.2f). Manual intervention needed.",
            workload, HealingAction.ROLLED_BACK.attempt(), risk.probability()));
    }

    public static HealingEvent permissionDenied(WorkloadRef workload, String operation) {
        return new HealingEvent(Type.PERMISSION_DENIED, workload, String.format(
            ":no_entry: *Auto-heal is not permitted* to %s deployment `%s`. Check the control plane's RBAC.",
            operation, workload));
    }

    /**
     * Same event with an extra sentence appended.
     */
    public HealingEvent withNote(String note) {
        return new HealingEvent(type, workload, text + " " + note);
    }

    private static String degradedSuffix(RiskAssessment risk) {
        return risk.degraded() ? ", fallback heuristic" : "";
    }
}
