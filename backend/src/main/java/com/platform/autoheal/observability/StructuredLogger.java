package com.platform.autoheal.observability;

import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.state.HealingAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for healing decisions.
 *
 * All lines are JSON-formatted and machine-parsable, written to the
 * {@code structured.healing} logger.
 */
@Component
public class StructuredLogger {

    @Value("${spring.application.name:autoheal-control-plane}")
    private String serviceName;

    @Value("${otel.environment:development}")
    private String environment;

    public HealingLogger healing() {
        return new HealingLogger(serviceName, environment);
    }

    // ==================== HEALING LOGGER ====================

    public static class HealingLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.healing");
        private final String service;
        private final String environment;

        HealingLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void escalated(WorkloadRef workload, HealingAction action, int attempt,
                RiskAssessment assessment, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_ESCALATED, "INFO")
                .actor("orchestrator")
                .workload(workload.toString())
                .action(action.name())
                .attempt(attempt)
                .probability(assessment.probability())
                .degraded(assessment.degraded())
                .success(true)
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }

        public void actionFailed(WorkloadRef workload, HealingAction action, int attempt,
                String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_ACTION_FAILED, "WARN")
                .actor("orchestrator")
                .workload(workload.toString())
                .action(action.name())
                .attempt(attempt)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.warn(event.toJson());
        }

        public void recovered(WorkloadRef workload, int previousAttempt, RiskAssessment assessment) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_RECOVERED, "INFO")
                .actor("orchestrator")
                .workload(workload.toString())
                .attempt(0)
                .probability(assessment.probability())
                .degraded(assessment.degraded())
                .context(Map.of("previous_attempt", previousAttempt))
                .build();
            log.info(event.toJson());
        }

        public void exhausted(WorkloadRef workload, RiskAssessment assessment) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_EXHAUSTED, "WARN")
                .actor("orchestrator")
                .workload(workload.toString())
                .attempt(3)
                .probability(assessment.probability())
                .message("Escalation ladder exhausted, manual intervention needed")
                .build();
            log.warn(event.toJson());
        }

        public void reset(WorkloadRef workload, int previousAttempt, String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_RESET, "INFO")
                .actor(actor)
                .workload(workload.toString())
                .attempt(0)
                .context(Map.of("previous_attempt", previousAttempt))
                .build();
            log.info(event.toJson());
        }

        public void conflict(WorkloadRef workload, String phase, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_CONFLICT, "INFO")
                .actor("orchestrator")
                .workload(workload.toString())
                .message("Decision discarded at " + phase)
                .errorMessage(errorMessage)
                .build();
            log.info(event.toJson());
        }

        public void permissionDenied(WorkloadRef workload, String operation, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_PERMISSION_DENIED, "ERROR")
                .actor("orchestrator")
                .workload(workload.toString())
                .action(operation)
                .success(false)
                .errorCode("AH-201")
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }

        public void claimAbandoned(WorkloadRef workload, HealingAction action, long ageMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_CLAIM_ABANDONED, "WARN")
                .actor("orchestrator")
                .workload(workload.toString())
                .action(action.name())
                .message("Resuming tier left in flight by an interrupted cycle")
                .context(Map.of("claim_age_ms", ageMs))
                .build();
            log.warn(event.toJson());
        }

        public void recheck(WorkloadRef workload, RiskAssessment assessment) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.HEALING_RECHECK, "INFO")
                .actor("recheck")
                .workload(workload.toString())
                .probability(assessment.probability())
                .degraded(assessment.degraded())
                .context(Map.of("still_high", assessment.isHigh()))
                .build();
            log.info(event.toJson());
        }
    }
}
