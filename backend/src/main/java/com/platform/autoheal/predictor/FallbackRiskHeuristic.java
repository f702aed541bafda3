package com.platform.autoheal.predictor;

import com.platform.autoheal.model.FeatureRecord;

/**
 * Deterministic score used when the inference service is unavailable.
 * CPU, 5xx rate and unavailable replicas dominate; the weights sum to 1.
 */
public final class FallbackRiskHeuristic {

    static final double CPU_WEIGHT = 0.30;
    static final double ERROR_RATE_WEIGHT = 0.25;
    static final double UNAVAILABLE_WEIGHT = 0.15;
    static final double NOT_READY_WEIGHT = 0.10;
    static final double RESTART_WEIGHT = 0.10;
    static final double MEMORY_WEIGHT = 0.10;

    private static final double RESTART_SATURATION = 5.0;
    private static final double MEMORY_SATURATION_BYTES = 1024.0 * 1024.0 * 1024.0;

    private FallbackRiskHeuristic() {
    }

    public static double score(FeatureRecord f) {
        double unavailable = f.unavailableReplicas();
        double score = CPU_WEIGHT * (f.cpuUsagePct() / 100.0)
            + ERROR_RATE_WEIGHT * Math.min(f.http5xxErrorRate(), 1.0)
            + UNAVAILABLE_WEIGHT * (unavailable / (unavailable + 1.0))
            + NOT_READY_WEIGHT * (1.0 - f.readyReplicaRatio())
            + RESTART_WEIGHT * Math.min(f.restartCountLast5m() / RESTART_SATURATION, 1.0)
            + MEMORY_WEIGHT * Math.min(f.memoryUsageBytes() / MEMORY_SATURATION_BYTES, 1.0);

        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
