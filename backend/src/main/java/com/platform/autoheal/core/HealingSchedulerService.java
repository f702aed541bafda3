package com.platform.autoheal.core;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.AutoHealException;
import com.platform.autoheal.error.ResourceNotFoundException;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.observability.MetricsRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic evaluation of every configured workload.
 *
 * Workloads are evaluated one after another; a failure on one is logged and counted and the
 * loop moves on.
 */
@Slf4j
@Service
public class HealingSchedulerService {

    private final HealingOrchestrator orchestrator;
    private final AutoHealProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong runCount = new AtomicLong(0);
    private final AtomicLong evaluationCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private final Map<String, CycleOutcome> lastOutcomes = new ConcurrentHashMap<>();
    private volatile Instant lastRunAt;

    public HealingSchedulerService(
            HealingOrchestrator orchestrator,
            AutoHealProperties properties,
            MetricsRegistry metricsRegistry,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("autoheal.scheduler.runs", runCount, AtomicLong::get)
            .description("Total scheduler runs")
            .register(meterRegistry);

        Gauge.builder("autoheal.scheduler.failures", failureCount, AtomicLong::get)
            .description("Total failed workload evaluations")
            .register(meterRegistry);

        log.info("Healing scheduler initialized (enabled={}, interval={}ms, workloads={})",
            properties.getScheduler().isEnabled(),
            properties.getScheduler().getIntervalMs(),
            properties.getWorkloads().size());
    }

    @Scheduled(fixedDelayString = "${autoheal.scheduler.interval-ms:60000}",
               initialDelayString = "${autoheal.scheduler.initial-delay-ms:10000}")
    public void periodicEvaluation() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }

        int failures = 0;
        for (AutoHealProperties.ManagedWorkload managed : properties.getWorkloads()) {
            if (!evaluateOne(managed)) {
                failures++;
            }
        }

        runCount.incrementAndGet();
        lastRunAt = clock.instant();
        if (failures > 0) {
            log.info("Healing run complete: workloads={}, failures={}", properties.getWorkloads().size(), failures);
        }
    }

    private boolean evaluateOne(AutoHealProperties.ManagedWorkload managed) {
        WorkloadRef workload;
        try {
            workload = managed.toRef();
        } catch (AutoHealException e) {
            log.error("Skipping misconfigured workload {}/{}: {}", managed.getNamespace(), managed.getName(), e.getMessage());
            failureCount.incrementAndGet();
            return false;
        }

        try {
            CycleReport report = orchestrator.evaluate(workload);
            evaluationCount.incrementAndGet();
            lastOutcomes.put(workload.toString(), report.outcome());
            return true;
        } catch (ResourceNotFoundException e) {
            log.warn("Managed workload {} not found, skipping: {}", workload, e.getMessage());
        } catch (AutoHealException e) {
            log.error("Healing cycle failed for {} [{}]: {}", workload, e.getErrorCode().getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in healing cycle for {}", workload, e);
        }
        failureCount.incrementAndGet();
        metricsRegistry.incrementCounter("autoheal.scheduler.error", "workload", workload.toString());
        return false;
    }

    public SchedulerStats getStats() {
        return new SchedulerStats(
            properties.getScheduler().isEnabled(),
            properties.getScheduler().getIntervalMs(),
            runCount.get(),
            evaluationCount.get(),
            failureCount.get(),
            lastRunAt,
            Map.copyOf(lastOutcomes)
        );
    }

    public record SchedulerStats(
        boolean enabled,
        long intervalMs,
        long runs,
        long evaluations,
        long failures,
        Instant lastRunAt,
        Map<String, CycleOutcome> lastOutcomes
    ) {}
}
