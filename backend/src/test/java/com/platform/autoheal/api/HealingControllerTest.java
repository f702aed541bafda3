package com.platform.autoheal.api;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.core.CycleOutcome;
import com.platform.autoheal.core.CycleReport;
import com.platform.autoheal.core.HealingOrchestrator;
import com.platform.autoheal.core.HealingSchedulerService;
import com.platform.autoheal.core.WorkloadStatus;
import com.platform.autoheal.error.PermissionDeniedException;
import com.platform.autoheal.error.StateConflictException;
import com.platform.autoheal.error.TransientIOException;
import com.platform.autoheal.model.RiskAssessment;
import com.platform.autoheal.model.WorkloadRef;
import com.platform.autoheal.observability.MetricsRegistry;
import com.platform.autoheal.state.HealingAction;
import com.platform.autoheal.state.HealingPhase;
import com.platform.autoheal.state.HealingState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealingController.class)
class HealingControllerTest {

    private static final WorkloadRef WORKLOAD = WorkloadRef.of("default", "flask-app");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealingOrchestrator orchestrator;

    @MockBean
    private HealingSchedulerService schedulerService;

    @MockBean
    private MetricsRegistry metricsRegistry;

    @TestConfiguration
    static class Workloads {
        @Bean
        AutoHealProperties autoHealProperties() {
            AutoHealProperties properties = new AutoHealProperties();
            AutoHealProperties.ManagedWorkload managed = new AutoHealProperties.ManagedWorkload();
            managed.setNamespace(WORKLOAD.namespace());
            managed.setName(WORKLOAD.name());
            properties.getWorkloads().add(managed);
            return properties;
        }
    }

    private static WorkloadStatus workloadStatus(int attempt) {
        HealingState state = HealingState.normalized(WORKLOAD, attempt, Instant.parse("2024-05-01T10:00:00Z"),
            "v1", null);
        return WorkloadStatus.of(state, Instant.parse("2024-05-01T10:01:00Z"), Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("GET status should return the phase and attempt of a managed workload")
    void getStatus() throws Exception {
        when(orchestrator.status(WORKLOAD)).thenReturn(workloadStatus(2));

        mockMvc.perform(get("/api/healing/default/flask-app"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.workload").value("default/flask-app"))
            .andExpect(jsonPath("$.phase").value("ESCALATING_2"))
            .andExpect(jsonPath("$.attempt").value(2))
            .andExpect(jsonPath("$.lastAction").value("CACHE_CLEARED"));
    }

    @Test
    @DisplayName("GET workloads should list each configured workload")
    void listWorkloads() throws Exception {
        when(orchestrator.status(WORKLOAD)).thenReturn(workloadStatus(0));

        mockMvc.perform(get("/api/healing/workloads"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].workload").value("default/flask-app"))
            .andExpect(jsonPath("$[0].status.phase").value("HEALTHY"));
    }

    @Test
    @DisplayName("GET workloads should report a per-workload error instead of failing")
    void listWorkloadsWithError() throws Exception {
        when(orchestrator.status(WORKLOAD)).thenThrow(TransientIOException.kubernetes("api server down", null));

        mockMvc.perform(get("/api/healing/workloads"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].error").value("AH-430: api server down"));
    }

    @Test
    @DisplayName("POST evaluate should return the cycle report")
    void evaluate() throws Exception {
        when(orchestrator.evaluate(WORKLOAD)).thenReturn(CycleReport.builder()
            .workload("default/flask-app")
            .outcome(CycleOutcome.ESCALATED)
            .phaseBefore(HealingPhase.HEALTHY)
            .phaseAfter(HealingPhase.ESCALATING_1)
            .assessment(RiskAssessment.of(0.9, 0.5, false))
            .action(HealingAction.RESTARTED)
            .message("Applied tier 1 (RESTARTED)")
            .build());

        mockMvc.perform(post("/api/healing/default/flask-app/evaluate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("ESCALATED"))
            .andExpect(jsonPath("$.action").value("RESTARTED"))
            .andExpect(jsonPath("$.assessment.riskLabel").value("HIGH"));
    }

    @Test
    @DisplayName("a workload outside the configuration should be 404 and never evaluated")
    void unmanagedWorkload() throws Exception {
        mockMvc.perform(post("/api/healing/default/other-app/evaluate"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("AH-301"));

        verify(orchestrator, never()).evaluate(any());
    }

    @Test
    @DisplayName("an invalid workload name should be rejected with 400")
    void invalidName() throws Exception {
        mockMvc.perform(get("/api/healing/default/Not_Valid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("AH-103"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("name"));
    }

    @Test
    @DisplayName("a reset racing a cycle should be 409")
    void resetConflict() throws Exception {
        when(orchestrator.reset(WORKLOAD)).thenThrow(new StateConflictException(WORKLOAD, "v1", "v2"));

        mockMvc.perform(post("/api/healing/default/flask-app/reset"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("AH-312"));
    }

    @Test
    @DisplayName("a reset without write permission should be 403")
    void resetForbidden() throws Exception {
        when(orchestrator.reset(WORKLOAD)).thenThrow(
            new PermissionDeniedException(WORKLOAD, "write-state", new RuntimeException("forbidden")));

        mockMvc.perform(post("/api/healing/default/flask-app/reset"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("AH-201"));
    }

    @Test
    @DisplayName("a successful reset should return the new status")
    void reset() throws Exception {
        when(orchestrator.status(WORKLOAD)).thenReturn(workloadStatus(0));

        mockMvc.perform(post("/api/healing/default/flask-app/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phase").value("HEALTHY"));

        verify(orchestrator).reset(WORKLOAD);
    }

    @Test
    @DisplayName("GET scheduler should expose run statistics")
    void schedulerStats() throws Exception {
        when(schedulerService.getStats()).thenReturn(new HealingSchedulerService.SchedulerStats(
            true, 60000, 4, 4, 0, null, Map.of("default/flask-app", CycleOutcome.NO_ACTION)));

        mockMvc.perform(get("/api/healing/scheduler"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runs").value(4))
            .andExpect(jsonPath("$.lastOutcomes['default/flask-app']").value("NO_ACTION"));
    }
}
