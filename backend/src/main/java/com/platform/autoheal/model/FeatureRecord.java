package com.platform.autoheal.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.autoheal.error.ValidationException;
import lombok.Builder;

/**
 * The runtime signals sampled for one risk evaluation.
 * Serialized as-is as the body of the inference request.
 */
@Builder
public record FeatureRecord(
    @JsonProperty("restart_count_last_5m") long restartCountLast5m,
    @JsonProperty("cpu_usage_pct") double cpuUsagePct,
    @JsonProperty("memory_usage_bytes") long memoryUsageBytes,
    @JsonProperty("ready_replica_ratio") double readyReplicaRatio,
    @JsonProperty("unavailable_replicas") long unavailableReplicas,
    @JsonProperty("network_receive_bytes_per_s") double networkReceiveBytesPerS,
    @JsonProperty("http_5xx_error_rate") double http5xxErrorRate
) {

    public FeatureRecord {
        requireNonNegative("restart_count_last_5m", restartCountLast5m);
        requireNonNegative("cpu_usage_pct", cpuUsagePct);
        requireNonNegative("memory_usage_bytes", memoryUsageBytes);
        requireNonNegative("ready_replica_ratio", readyReplicaRatio);
        requireNonNegative("unavailable_replicas", unavailableReplicas);
        requireNonNegative("network_receive_bytes_per_s", networkReceiveBytesPerS);
        requireNonNegative("http_5xx_error_rate", http5xxErrorRate);
        if (cpuUsagePct > 100.0) {
            throw new ValidationException("cpu_usage_pct", cpuUsagePct, "must be at most 100");
        }
        if (readyReplicaRatio > 1.0) {
            throw new ValidationException("ready_replica_ratio", readyReplicaRatio, "must be at most 1");
        }
    }

    /**
     * A snapshot of a workload with no load and all replicas ready.
     */
    public static FeatureRecord idle() {
        return new FeatureRecord(0, 0.0, 0, 1.0, 0, 0.0, 0.0);
    }

    private static void requireNonNegative(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ValidationException(field, value, "must be a finite non-negative number");
        }
    }
}
