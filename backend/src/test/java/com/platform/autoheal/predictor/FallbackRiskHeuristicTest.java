package com.platform.autoheal.predictor;

import com.platform.autoheal.model.FeatureRecord;
import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.RiskLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FallbackRiskHeuristicTest {

    @Test
    @DisplayName("idle workload should score zero")
    void idleScoresZero() {
        assertThat(FallbackRiskHeuristic.score(FeatureRecord.idle())).isEqualTo(0.0);
    }

    @Test
    @DisplayName("high cpu with saturated 5xx rate should be HIGH at the default threshold")
    void hotWorkloadIsHigh() {
        FeatureRecord features = FeatureRecord.builder()
            .cpuUsagePct(85)
            .http5xxErrorRate(1)
            .readyReplicaRatio(1.0)
            .build();

        double score = FallbackRiskHeuristic.score(features);

        assertThat(score).isCloseTo(0.505, within(1e-9));
        assertThat(RiskAssessment.of(score, 0.5, true).riskLabel()).isEqualTo(RiskLabel.HIGH);
    }

    @Test
    @DisplayName("fully degraded workload should saturate at one")
    void saturatesAtOne() {
        FeatureRecord worst = FeatureRecord.builder()
            .restartCountLast5m(50)
            .cpuUsagePct(100)
            .memoryUsageBytes(8L * 1024 * 1024 * 1024)
            .readyReplicaRatio(0)
            .unavailableReplicas(1_000_000)
            .http5xxErrorRate(40)
            .build();

        assertThat(FallbackRiskHeuristic.score(worst)).isGreaterThan(0.99).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("weights should sum to one")
    void weightsSumToOne() {
        double sum = FallbackRiskHeuristic.CPU_WEIGHT + FallbackRiskHeuristic.ERROR_RATE_WEIGHT
            + FallbackRiskHeuristic.UNAVAILABLE_WEIGHT + FallbackRiskHeuristic.NOT_READY_WEIGHT
            + FallbackRiskHeuristic.RESTART_WEIGHT + FallbackRiskHeuristic.MEMORY_WEIGHT;

        assertThat(sum).isCloseTo(1.0, within(1e-9));
    }
}
