package com.platform.autoheal.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.config.RestTemplateConfig;
import com.platform.autoheal.error.TransientIOException;
import com.platform.autoheal.model.FeatureRecord;
import com.platform.autoheal.model.WorkloadRef;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Samples the seven runtime signals of a workload from a Prometheus-compatible backend.
 *
 * Each signal is an instant query. An empty result means the signal has no data and reads
 * as its neutral value; values are clamped into the ranges {@link FeatureRecord} accepts.
 */
@Slf4j
@Component
public class FeatureSnapshotReader {

    public static final String RESTART_COUNT = "restart_count_last_5m";
    public static final String CPU_USAGE = "cpu_usage_pct";
    public static final String MEMORY_USAGE = "memory_usage_bytes";
    public static final String READY_RATIO = "ready_replica_ratio";
    public static final String UNAVAILABLE_REPLICAS = "unavailable_replicas";
    public static final String NETWORK_RECEIVE = "network_receive_bytes_per_s";
    public static final String HTTP_5XX_RATE = "http_5xx_error_rate";

    private static final String QUERY_PATH = "/api/v1/query?query={query}";

    private final RestTemplate restTemplate;
    private final Map<String, String> queries;
    private final Retry retry;

    public FeatureSnapshotReader(
            @Qualifier(RestTemplateConfig.METRICS) RestTemplate restTemplate,
            AutoHealProperties properties,
            RetryRegistry retryRegistry) {
        this.restTemplate = restTemplate;
        this.queries = properties.getMetrics().getQueries();
        this.retry = retryRegistry.retry("metrics");
    }

    /**
     * Read a fresh snapshot.
     *
     * @throws TransientIOException if the backend cannot be queried after one retry
     */
    public FeatureRecord read(WorkloadRef workload) {
        FeatureRecord record = FeatureRecord.builder()
            .restartCountLast5m(Math.round(sample(workload, RESTART_COUNT, 0.0)))
            .cpuUsagePct(Math.min(100.0, sample(workload, CPU_USAGE, 0.0)))
            .memoryUsageBytes(Math.round(sample(workload, MEMORY_USAGE, 0.0)))
            .readyReplicaRatio(Math.min(1.0, sample(workload, READY_RATIO, 1.0)))
            .unavailableReplicas(Math.round(sample(workload, UNAVAILABLE_REPLICAS, 0.0)))
            .networkReceiveBytesPerS(sample(workload, NETWORK_RECEIVE, 0.0))
            .http5xxErrorRate(sample(workload, HTTP_5XX_RATE, 0.0))
            .build();

        log.debug("Feature snapshot for {}: {}", workload, record);
        return record;
    }

    private double sample(WorkloadRef workload, String feature, double neutral) {
        String template = queries.get(feature);
        if (template == null || template.isBlank()) {
            return neutral;
        }
        String promql = template
            .replace("{namespace}", workload.namespace())
            .replace("{workload}", workload.name());

        Double value = retry.executeSupplier(() -> query(feature, promql));
        if (value == null || value.isNaN() || value.isInfinite()) {
            return neutral;
        }
        return Math.max(0.0, value);
    }

    private Double query(String feature, String promql) {
        JsonNode body;
        try {
            body = restTemplate.getForObject(QUERY_PATH, JsonNode.class, promql);
        } catch (RestClientException e) {
            throw TransientIOException.metrics("Query for " + feature + " failed: " + e.getMessage(), e);
        }
        if (body == null || !"success".equals(body.path("status").asText())) {
            throw TransientIOException.metrics("Query for " + feature + " was not successful: "
                + (body != null ? body.path("error").asText("no error detail") : "empty body"), null);
        }

        JsonNode result = body.path("data").path("result");
        if (!result.isArray() || result.isEmpty()) {
            return null;
        }
        JsonNode sampleValue = result.get(0).path("value").path(1);
        try {
            return Double.parseDouble(sampleValue.asText());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric sample for {}: {}", feature, sampleValue);
            return null;
        }
    }
}
