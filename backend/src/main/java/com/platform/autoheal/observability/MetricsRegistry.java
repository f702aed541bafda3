package com.platform.autoheal.observability;

import com.platform.autoheal.model.WorkloadRef;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for auto-heal metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, AtomicInteger> attemptGauges;
    private final Timer cycleTimer;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.attemptGauges = new ConcurrentHashMap<>();
        this.cycleTimer = Timer.builder("autoheal.cycle.duration")
            .description("Duration of one healing evaluation cycle")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    /**
     * Record the outcome of an evaluation cycle.
     */
    public void recordCycle(String outcome, long durationMs) {
        incrementCounter("autoheal.cycle", "outcome", outcome);
        cycleTimer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Record a remediation action against a workload.
     */
    public void recordAction(String action, boolean success) {
        incrementCounter("autoheal.action", "action", action, "success", String.valueOf(success));
    }

    public void recordPredictorFallback(String reason) {
        incrementCounter("autoheal.predictor.fallback", "reason", reason);
    }

    public void recordStateConflict(String phase) {
        incrementCounter("autoheal.state.conflict", "phase", phase);
    }

    public void recordNotification(String event, boolean delivered) {
        incrementCounter("autoheal.notification", "event", event, "result", delivered ? "delivered" : "failed");
    }

    public void recordRecheck(boolean stillHigh) {
        incrementCounter("autoheal.recheck", "still_high", String.valueOf(stillHigh));
    }

    /**
     * Publish the current escalation attempt of a workload.
     */
    public void updateAttempt(WorkloadRef workload, int attempt) {
        attemptGauges.computeIfAbsent(workload.toString(), key -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder("autoheal.attempt", value, AtomicInteger::get)
                .description("Current healing attempt per workload")
                .tag("workload", key)
                .register(meterRegistry);
            return value;
        }).set(attempt);
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
