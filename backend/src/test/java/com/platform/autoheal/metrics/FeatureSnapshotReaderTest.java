package com.platform.autoheal.metrics;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.ErrorCode;
import com.platform.autoheal.error.TransientIOException;
import com.platform.autoheal.model.FeatureRecord;
import com.platform.autoheal.model.WorkloadRef;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FeatureSnapshotReaderTest {

    private static final WorkloadRef WORKLOAD = WorkloadRef.of("default", "flask-app");

    private MockRestServiceServer server;
    private FeatureSnapshotReader reader;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://prometheus").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        // Plain templates keep the encoded query parameter readable
        Map<String, String> queries = new LinkedHashMap<>();
        queries.put(FeatureSnapshotReader.RESTART_COUNT, "restarts_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.CPU_USAGE, "cpu_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.MEMORY_USAGE, "memory_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.READY_RATIO, "ready_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.UNAVAILABLE_REPLICAS, "unavailable_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.NETWORK_RECEIVE, "network_{namespace}_{workload}");
        queries.put(FeatureSnapshotReader.HTTP_5XX_RATE, "errors_{namespace}_{workload}");

        AutoHealProperties properties = new AutoHealProperties();
        properties.getMetrics().setQueries(queries);

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
            .maxAttempts(2)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(TransientIOException.class)
            .build());

        reader = new FeatureSnapshotReader(restTemplate, properties, retryRegistry);
    }

    private static String vector(String value) {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":"
            + "[{\"metric\":{},\"value\":[1714557600.0,\"" + value + "\"]}]}}";
    }

    private static String emptyVector() {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}";
    }

    private void expectQuery(String query, String body) {
        server.expect(requestTo(startsWith("http://prometheus/api/v1/query")))
            .andExpect(queryParam("query", query))
            .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("should map every signal and clamp out of range values")
    void mapsSignals() {
        expectQuery("restarts_default_flask-app", vector("3"));
        expectQuery("cpu_default_flask-app", vector("130.2"));
        expectQuery("memory_default_flask-app", vector("268435456"));
        expectQuery("ready_default_flask-app", vector("1.5"));
        expectQuery("unavailable_default_flask-app", vector("1"));
        expectQuery("network_default_flask-app", vector("2048.5"));
        expectQuery("errors_default_flask-app", vector("0.25"));

        FeatureRecord record = reader.read(WORKLOAD);

        assertThat(record.restartCountLast5m()).isEqualTo(3);
        assertThat(record.cpuUsagePct()).isEqualTo(100.0);
        assertThat(record.memoryUsageBytes()).isEqualTo(268435456L);
        assertThat(record.readyReplicaRatio()).isEqualTo(1.0);
        assertThat(record.unavailableReplicas()).isEqualTo(1);
        assertThat(record.networkReceiveBytesPerS()).isEqualTo(2048.5);
        assertThat(record.http5xxErrorRate()).isEqualTo(0.25);
        server.verify();
    }

    @Test
    @DisplayName("empty and NaN results should read as neutral values")
    void neutralValues() {
        expectQuery("restarts_default_flask-app", emptyVector());
        expectQuery("cpu_default_flask-app", vector("NaN"));
        expectQuery("memory_default_flask-app", emptyVector());
        expectQuery("ready_default_flask-app", emptyVector());
        expectQuery("unavailable_default_flask-app", emptyVector());
        expectQuery("network_default_flask-app", emptyVector());
        expectQuery("errors_default_flask-app", vector("-0.5"));

        assertThat(reader.read(WORKLOAD)).isEqualTo(FeatureRecord.idle());
    }

    @Test
    @DisplayName("backend failure should surface as metrics unavailable after one retry")
    void failsAfterRetry() {
        server.expect(ExpectedCount.times(2), requestTo(startsWith("http://prometheus/api/v1/query")))
            .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> reader.read(WORKLOAD))
            .isInstanceOf(TransientIOException.class)
            .satisfies(e -> assertThat(((TransientIOException) e).getErrorCode()).isEqualTo(ErrorCode.METRICS_UNAVAILABLE));
        server.verify();
    }

    @Test
    @DisplayName("unsuccessful query status should be treated as a failure")
    void errorStatus() {
        server.expect(ExpectedCount.times(2), requestTo(startsWith("http://prometheus/api/v1/query")))
            .andRespond(withSuccess("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}",
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> reader.read(WORKLOAD))
            .isInstanceOf(TransientIOException.class)
            .hasMessageContaining("parse error");
    }
}
