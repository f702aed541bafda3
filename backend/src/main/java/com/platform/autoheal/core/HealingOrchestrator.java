package com.platform.autoheal.core;

import com.platform.autoheal.actuator.ActionResult;
import com.platform.autoheal.actuator.WorkloadActuator;
import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.ActuatorException;
import com.platform.autoheal.error.AutoHealException;
import com.platform.autoheal.error.PermissionDeniedException;
import com.platform.autoheal.error.StateConflictException;
import com.platform.autoheal.error.TransientIOException;
import com.platform.autoheal.metrics.FeatureSnapshotReader;
import com.platform.autoheal.model.FeatureRecord;
import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.notify.HealingEvent;
import com.platform.autoheal.notify.WebhookNotifier;
import com.platform.autoheal.observability.LoggingConfig;
import com.platform.autoheal.observability.MetricsRegistry;
import com.platform.autoheal.observability.StructuredLogger;
import com.platform.autoheal.predictor.RiskPredictor;
import com.platform.autoheal.state.HealingAction;
import com.platform.autoheal.state.HealingPhase;
import com.platform.autoheal.state.HealingState;
import com.platform.autoheal.state.HealingStateStore;
import com.platform.autoheal.state.Transition;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Risk-driven healing: one evaluation cycle per call.
 *
 * Every state change goes through a compare-and-set on the version token read at the start
 * of the cycle. An escalation is claimed before the actuator runs and committed after it
 * succeeds, so two racing cycles never both act and an interrupted cycle leaves a claim that
 * the next cycle resumes once it expires.
 */
@Slf4j
@Service
public class HealingOrchestrator {

    private static final String UNRECORDED_NOTE =
        "State not recorded, the tier will be re-issued.";

    private final HealingStateStore stateStore;
    private final FeatureSnapshotReader snapshotReader;
    private final RiskPredictor riskPredictor;
    private final WorkloadActuator actuator;
    private final WebhookNotifier notifier;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Tracer tracer;
    private final TaskScheduler taskScheduler;
    private final AutoHealProperties.Orchestrator config;
    private final Clock clock;

    public HealingOrchestrator(
            HealingStateStore stateStore,
            FeatureSnapshotReader snapshotReader,
            RiskPredictor riskPredictor,
            WorkloadActuator actuator,
            WebhookNotifier notifier,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Tracer tracer,
            TaskScheduler taskScheduler,
            AutoHealProperties properties,
            Clock clock) {
        this.stateStore = stateStore;
        this.snapshotReader = snapshotReader;
        this.riskPredictor = riskPredictor;
        this.actuator = actuator;
        this.notifier = notifier;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.tracer = tracer;
        this.taskScheduler = taskScheduler;
        this.config = properties.getOrchestrator();
        this.clock = clock;
    }

    /**
     * Run one evaluation cycle.
     *
     * @throws com.platform.autoheal.error.ResourceNotFoundException if the Deployment does not exist
     */
    public CycleReport evaluate(WorkloadRef workload) {
        long startNanos = System.nanoTime();
        String cycleId = LoggingConfig.setCycleContext(workload);
        Span span = tracer.spanBuilder("autoheal.cycle")
            .setAttribute("autoheal.workload", workload.toString())
            .setAttribute("autoheal.cycle_id", cycleId)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            CycleReport report = runCycle(workload, startNanos);

            span.setAttribute("autoheal.outcome", report.outcome().name());
            span.setAttribute("autoheal.attempt", report.attemptAfter());
            metricsRegistry.recordCycle(report.outcome().name(), report.durationMs());
            if (report.outcome() != CycleOutcome.PERMISSION_DENIED) {
                // attempt is unknown when the state could not be read
                metricsRegistry.updateAttempt(workload, report.attemptAfter());
            }

            log.info("[AUDIT] Cycle for {}: outcome={}, phase={}->{}, action={}, risk={}, duration={}ms",
                workload, report.outcome(), report.phaseBefore(), report.phaseAfter(), report.action(),
                report.assessment() != null ? report.assessment().summary() : "n/a", report.durationMs());
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearCycleContext();
        }
    }

    /**
     * Operator reset: back to HEALTHY, any claim dropped. Sends no recovery notification.
     *
     * @throws StateConflictException if a cycle wrote in between
     */
    public HealingState reset(WorkloadRef workload) {
        HealingState current = stateStore.read(workload);
        HealingState stored = stateStore.compareAndSet(current, current.reset(clock.instant()));

        metricsRegistry.updateAttempt(workload, 0);
        structuredLogger.healing().reset(workload, current.attempt(), "operator");
        log.info("[AUDIT] Operator reset {} from attempt {}", workload, current.attempt());
        return stored;
    }

    public WorkloadStatus status(WorkloadRef workload) {
        return WorkloadStatus.of(stateStore.read(workload), clock.instant(), config.getClaimTtl());
    }

    // ==================== Cycle ====================

    private CycleReport runCycle(WorkloadRef workload, long startNanos) {
        HealingState state;
        try {
            state = stateStore.read(workload);
        } catch (PermissionDeniedException e) {
            return permissionDenied(workload, HealingPhase.HEALTHY, HealingAction.NONE, null, e, startNanos);
        }
        HealingPhase phase = state.phase();
        Instant now = clock.instant();

        if (state.hasLiveClaim(now, config.getClaimTtl())) {
            log.info("Skipping {}: {} claimed {} ago by another cycle", workload,
                state.inFlight().action(), state.inFlight().age(now));
            return finish(CycleReport.of(workload, CycleOutcome.IN_FLIGHT, phase)
                .message("Tier " + state.inFlight().action() + " is in flight"), startNanos);
        }
        if (state.hasClaim()) {
            structuredLogger.healing().claimAbandoned(workload, state.inFlight().action(),
                state.inFlight().age(now).toMillis());
        }

        FeatureRecord features;
        try {
            features = snapshotReader.read(workload);
        } catch (TransientIOException e) {
            log.warn("Skipping {}: {}", workload, e.getMessage());
            return finish(CycleReport.of(workload, CycleOutcome.METRICS_UNAVAILABLE, phase)
                .message(e.getMessage()), startNanos);
        }
        RiskAssessment assessment = riskPredictor.assess(features);
        Transition transition = phase.next(assessment.riskLabel());

        log.info("[AUDIT] {} in {} assessed {}: {}", workload, phase, assessment.summary(), transition.kind());

        return switch (transition.kind()) {
            case STAY -> stay(state, assessment, startNanos);
            case RECOVER -> recover(state, assessment, startNanos);
            case EXHAUSTED -> exhausted(state, assessment, startNanos);
            case ESCALATE -> escalate(state, transition, assessment, startNanos);
        };
    }

    private CycleReport stay(HealingState state, RiskAssessment assessment, long startNanos) {
        if (state.hasClaim()) {
            // Abandoned claim at attempt 0 with risk gone
            try {
                stateStore.compareAndSet(state, state.release(clock.instant()));
            } catch (StateConflictException e) {
                log.debug("Stale claim on {} already replaced: {}", state.workload(), e.getMessage());
            }
        }
        return finish(CycleReport.of(state.workload(), CycleOutcome.NO_ACTION, state.phase())
            .assessment(assessment)
            .message("Risk " + assessment.riskLabel() + ", nothing to do"), startNanos);
    }

    private CycleReport recover(HealingState state, RiskAssessment assessment, long startNanos) {
        WorkloadRef workload = state.workload();
        try {
            stateStore.compareAndSet(state, state.reset(clock.instant()));
        } catch (StateConflictException e) {
            return conflict(state, assessment, HealingAction.NONE, "recover", e, startNanos);
        } catch (PermissionDeniedException e) {
            return permissionDenied(workload, state.phase(), HealingAction.NONE, assessment, e, startNanos);
        }

        structuredLogger.healing().recovered(workload, state.attempt(), assessment);
        notifier.notify(HealingEvent.recovery(workload, state.attempt(), assessment));

        return finish(CycleReport.of(workload, CycleOutcome.RECOVERED, state.phase())
            .phaseAfter(HealingPhase.HEALTHY)
            .assessment(assessment)
            .message("Recovered after " + state.attempt() + " attempt(s)"), startNanos);
    }

    private CycleReport exhausted(HealingState state, RiskAssessment assessment, long startNanos) {
        WorkloadRef workload = state.workload();
        log.error("Auto-healing exhausted for {} at attempt {}: manual intervention needed ({})",
            workload, state.attempt(), assessment.summary());
        structuredLogger.healing().exhausted(workload, assessment);
        notifier.notify(HealingEvent.exhausted(workload, assessment));

        return finish(CycleReport.of(workload, CycleOutcome.EXHAUSTED, state.phase())
            .assessment(assessment)
            .message("All tiers used, manual intervention needed"), startNanos);
    }

    private CycleReport escalate(HealingState state, Transition transition, RiskAssessment assessment,
                                 long startNanos) {
        WorkloadRef workload = state.workload();
        HealingAction action = transition.action();

        HealingState claimed;
        try {
            claimed = stateStore.compareAndSet(state, state.claim(action, clock.instant()));
        } catch (StateConflictException e) {
            return conflict(state, assessment, action, "claim", e, startNanos);
        } catch (PermissionDeniedException e) {
            return permissionDenied(workload, state.phase(), action, assessment, e, startNanos);
        }

        long actionStart = System.nanoTime();
        String actionMessage;
        try {
            actionMessage = perform(workload, action);
        } catch (PermissionDeniedException e) {
            metricsRegistry.recordAction(action.name(), false);
            release(claimed);
            return permissionDenied(workload, state.phase(), action, assessment, e, startNanos);
        } catch (ActuatorException e) {
            metricsRegistry.recordAction(action.name(), false);
            structuredLogger.healing().actionFailed(workload, action, transition.to().attempt(),
                e.getErrorCode().getCode(), e.getMessage());
            log.warn("{} failed for {}, tier will be retried next cycle: {}", action, workload, e.getMessage());
            release(claimed);
            return finish(CycleReport.of(workload, CycleOutcome.ACTUATOR_FAILED, state.phase())
                .assessment(assessment)
                .action(action)
                .message(e.getMessage()), startNanos);
        }
        metricsRegistry.recordAction(action.name(), true);
        long actionMs = (System.nanoTime() - actionStart) / 1_000_000;

        try {
            stateStore.compareAndSet(claimed, claimed.advanceTo(transition.to(), clock.instant()));
        } catch (StateConflictException e) {
            // Claim was overwritten while acting, typically by an operator reset
            return conflict(state, assessment, action, "commit", e, startNanos);
        } catch (PermissionDeniedException e) {
            release(claimed);
            notifier.notify(HealingEvent.escalation(workload, action, assessment).withNote(UNRECORDED_NOTE));
            return permissionDenied(workload, state.phase(), action, assessment, e, startNanos);
        } catch (AutoHealException e) {
            return unrecorded(state, action, assessment, e, startNanos);
        }

        structuredLogger.healing().escalated(workload, action, transition.to().attempt(), assessment, actionMs);
        notifier.notify(HealingEvent.escalation(workload, action, assessment));
        scheduleRecheck(workload);

        return finish(CycleReport.of(workload, CycleOutcome.ESCALATED, state.phase())
            .phaseAfter(transition.to())
            .assessment(assessment)
            .action(action)
            .message("Applied tier " + transition.to().attempt() + " (" + action + "): " + actionMessage), startNanos);
    }

    /**
     * The workload was changed but the commit failed. The claim stays and expires, after which
     * the same tier is issued again.
     */
    private CycleReport unrecorded(HealingState state, HealingAction action, RiskAssessment assessment,
                                   AutoHealException e, long startNanos) {
        WorkloadRef workload = state.workload();
        log.error("{} applied to {} but the state write failed [{}]: {}", action, workload,
            e.getErrorCode().getCode(), e.getMessage());
        structuredLogger.healing().actionFailed(workload, action, state.attempt() + 1,
            e.getErrorCode().getCode(), "state not recorded: " + e.getMessage());
        notifier.notify(HealingEvent.escalation(workload, action, assessment).withNote(UNRECORDED_NOTE));
        return finish(CycleReport.of(workload, CycleOutcome.STATE_NOT_RECORDED, state.phase())
            .assessment(assessment)
            .action(action)
            .message(e.getMessage()), startNanos);
    }

    private String perform(WorkloadRef workload, HealingAction action) {
        return switch (action) {
            case RESTARTED -> {
                ActionResult restart = actuator.restart(workload);
                ActionResult scale = actuator.scale(workload, actuator.desiredReplicas(workload));
                yield describe(restart, scale);
            }
            case CACHE_CLEARED -> {
                ActionResult clear = actuator.clearCache(workload);
                ActionResult scale = actuator.scale(workload, actuator.desiredReplicas(workload));
                yield describe(clear, scale);
            }
            case ROLLED_BACK -> describe(actuator.rollback(workload));
            case NONE -> throw new IllegalArgumentException("NONE is not a remediation tier");
        };
    }

    private static String describe(ActionResult... results) {
        return Arrays.stream(results)
            .filter(Objects::nonNull)
            .map(ActionResult::message)
            .collect(Collectors.joining("; "));
    }

    private void release(HealingState claimed) {
        try {
            stateStore.compareAndSet(claimed, claimed.release(clock.instant()));
        } catch (AutoHealException e) {
            log.warn("Could not release claim on {}, it will expire after {}: {}",
                claimed.workload(), config.getClaimTtl(), e.getMessage());
        }
    }

    private CycleReport conflict(HealingState state, RiskAssessment assessment, HealingAction action,
                                 String phase, StateConflictException e, long startNanos) {
        metricsRegistry.recordStateConflict(phase);
        structuredLogger.healing().conflict(state.workload(), phase, e.getMessage());
        log.info("Discarding decision for {} at {}: {}", state.workload(), phase, e.getMessage());
        return finish(CycleReport.of(state.workload(), CycleOutcome.CONFLICT, state.phase())
            .assessment(assessment)
            .action(action)
            .message(e.getMessage()), startNanos);
    }

    private CycleReport permissionDenied(WorkloadRef workload, HealingPhase phase, HealingAction action,
                                         RiskAssessment assessment, PermissionDeniedException e,
                                         long startNanos) {
        log.error("Permission denied while healing {} ({}): {}", workload, e.getOperation(), e.getMessage());
        structuredLogger.healing().permissionDenied(workload, e.getOperation(), e.getMessage());
        notifier.notify(HealingEvent.permissionDenied(workload, e.getOperation()));
        return finish(CycleReport.of(workload, CycleOutcome.PERMISSION_DENIED, phase)
            .assessment(assessment)
            .action(action)
            .message(e.getMessage()), startNanos);
    }

    private static CycleReport finish(CycleReport.CycleReportBuilder builder, long startNanos) {
        return builder.durationMs((System.nanoTime() - startNanos) / 1_000_000).build();
    }

    // ==================== Re-check ====================

    private void scheduleRecheck(WorkloadRef workload) {
        Duration cooldown = config.getCooldown();
        taskScheduler.schedule(() -> recheck(workload), clock.instant().plus(cooldown));
        log.debug("Re-check of {} scheduled in {}", workload, cooldown);
    }

    /**
     * Observes whether risk is still HIGH after the cooldown. Never writes state; the next
     * regular cycle escalates further if needed.
     */
    void recheck(WorkloadRef workload) {
        LoggingConfig.setCycleContext(workload);
        try {
            RiskAssessment assessment = riskPredictor.assess(snapshotReader.read(workload));
            metricsRegistry.recordRecheck(assessment.isHigh());
            structuredLogger.healing().recheck(workload, assessment);
            if (assessment.isHigh()) {
                log.warn("Risk for {} still {} after cooldown, next cycle will escalate", workload, assessment.summary());
            } else {
                log.info("Risk for {} is {} after cooldown", workload, assessment.summary());
            }
        } catch (AutoHealException e) {
            log.warn("Re-check of {} could not read signals: {}", workload, e.getMessage());
        } finally {
            LoggingConfig.clearCycleContext();
        }
    }
}
