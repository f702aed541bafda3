package com.platform.autoheal.config;

import com.platform.autoheal.model.WorkloadRef;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration properties for the auto-heal control plane.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "autoheal")
public class AutoHealProperties {

    /**
     * Deployments under management.
     */
    private List<ManagedWorkload> workloads = new ArrayList<>();

    private Risk risk = new Risk();

    private Predictor predictor = new Predictor();

    private Metrics metrics = new Metrics();

    private Orchestrator orchestrator = new Orchestrator();

    private Scheduler scheduler = new Scheduler();

    private Actuator actuator = new Actuator();

    private State state = new State();

    private Notifier notifier = new Notifier();

    /**
     * Look up a managed workload by reference.
     */
    public Optional<ManagedWorkload> findWorkload(WorkloadRef ref) {
        return workloads.stream()
            .filter(w -> w.toRef().equals(ref))
            .findFirst();
    }

    @Data
    public static class ManagedWorkload {
        private String namespace = "default";
        private String name;
        /**
         * Replica count restored by the restart tier. Null keeps the Deployment's own replica count.
         */
        private Integer replicas;

        public WorkloadRef toRef() {
            return WorkloadRef.of(namespace, name);
        }
    }

    @Data
    public static class Risk {
        /**
         * Probability at or above which a workload is HIGH risk.
         */
        private double threshold = 0.5;
    }

    @Data
    public static class Predictor {
        private String baseUrl = "http://localhost:5000";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Metrics {
        private String baseUrl = "http://localhost:9090";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);

        /**
         * PromQL template per feature; {namespace} and {workload} are substituted.
         */
        private Map<String, String> queries = new LinkedHashMap<>(defaultQueries());

        static Map<String, String> defaultQueries() {
            Map<String, String> queries = new LinkedHashMap<>();
            queries.put("restart_count_last_5m",
                "sum(increase(kube_pod_container_status_restarts_total{namespace=\"{namespace}\",pod=~\"{workload}-.*\"}[5m]))");
            queries.put("cpu_usage_pct",
                "sum(rate(container_cpu_usage_seconds_total{namespace=\"{namespace}\",pod=~\"{workload}-.*\"}[5m])) * 100");
            queries.put("memory_usage_bytes",
                "sum(container_memory_working_set_bytes{namespace=\"{namespace}\",pod=~\"{workload}-.*\"})");
            queries.put("ready_replica_ratio",
                "sum(kube_deployment_status_replicas_ready{namespace=\"{namespace}\",deployment=\"{workload}\"}) / sum(kube_deployment_spec_replicas{namespace=\"{namespace}\",deployment=\"{workload}\"})");
            queries.put("unavailable_replicas",
                "sum(kube_deployment_status_replicas_unavailable{namespace=\"{namespace}\",deployment=\"{workload}\"})");
            queries.put("network_receive_bytes_per_s",
                "sum(rate(container_network_receive_bytes_total{namespace=\"{namespace}\",pod=~\"{workload}-.*\"}[5m]))");
            // Share of the workload's requests answered with 5xx; NaN without traffic reads as 0
            queries.put("http_5xx_error_rate",
                "sum(rate(http_request_total{namespace=\"{namespace}\",pod=~\"{workload}-.*\",status=~\"5..\"}[5m]))"
                    + " / sum(rate(http_request_total{namespace=\"{namespace}\",pod=~\"{workload}-.*\"}[5m]))");
            return queries;
        }
    }

    @Data
    public static class Orchestrator {
        /**
         * Delay before the single post-escalation re-check.
         */
        private Duration cooldown = Duration.ofSeconds(120);

        /**
         * Age after which an uncommitted escalation claim counts as abandoned.
         */
        private Duration claimTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long intervalMs = 60000;
    }

    @Data
    public static class Actuator {
        private String cacheClearCommand = "rm -rf /tmp/*";
        private Duration execTimeout = Duration.ofSeconds(30);
        private boolean waitForRollout = true;
        private Duration rolloutTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class State {
        /**
         * Where healing state lives: kubernetes (Deployment annotations) or in-memory.
         */
        private String store = "kubernetes";

        /**
         * Bounded retries when the API server reports a write conflict that did not
         * come from a competing healing cycle.
         */
        private int writeRetries = 3;
    }

    @Data
    public static class Notifier {
        private boolean enabled = true;
        private String webhookUrl;
    }
}
