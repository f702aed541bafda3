package com.platform.autoheal.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.state.HealingAction;
import com.platform.autoheal.state.HealingPhase;
import lombok.Builder;

/**
 * Result of one evaluation cycle.
 *
 * @param assessment null when the cycle ended before risk was assessed
 * @param action     remediation attempted in this cycle, NONE if none
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleReport(
    String workload,
    CycleOutcome outcome,
    HealingPhase phaseBefore,
    HealingPhase phaseAfter,
    RiskAssessment assessment,
    HealingAction action,
    String message,
    long durationMs
) {

    public int attemptAfter() {
        return phaseAfter.attempt();
    }

    static CycleReportBuilder of(WorkloadRef workload, CycleOutcome outcome, HealingPhase phase) {
        return CycleReport.builder()
            .workload(workload.toString())
            .outcome(outcome)
            .phaseBefore(phase)
            .phaseAfter(phase)
            .action(HealingAction.NONE);
    }
}
