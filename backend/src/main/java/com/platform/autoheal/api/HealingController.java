package com.platform.autoheal.api;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.core.CycleReport;
import com.platform.autoheal.core.HealingOrchestrator;
import com.platform.autoheal.core.HealingSchedulerService;
import com.platform.autoheal.core.WorkloadStatus;
import com.platform.autoheal.error.AutoHealException;
import com.platform.autoheal.error.ResourceNotFoundException;
import com.platform.autoheal.model.WorkloadRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for inspecting and driving healing of managed workloads.
 */
@Slf4j
@RestController
@RequestMapping("/api/healing")
@RequiredArgsConstructor
public class HealingController {

    private final HealingOrchestrator orchestrator;
    private final HealingSchedulerService schedulerService;
    private final AutoHealProperties properties;

    /**
     * Configured workloads with their current phase. A workload whose state cannot be read
     * is listed with the error instead of failing the whole call.
     */
    @GetMapping("/workloads")
    public ResponseEntity<List<Map<String, Object>>> listWorkloads() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (AutoHealProperties.ManagedWorkload managed : properties.getWorkloads()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("workload", managed.getNamespace() + "/" + managed.getName());
            try {
                entry.put("status", orchestrator.status(managed.toRef()));
            } catch (AutoHealException e) {
                entry.put("error", e.getErrorCode().getCode() + ": " + e.getMessage());
            }
            result.add(entry);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{namespace}/{name}")
    public ResponseEntity<WorkloadStatus> getStatus(@PathVariable String namespace, @PathVariable String name) {
        return ResponseEntity.ok(orchestrator.status(managed(namespace, name)));
    }

    /**
     * Run one evaluation cycle now.
     */
    @PostMapping("/{namespace}/{name}/evaluate")
    public ResponseEntity<CycleReport> evaluate(@PathVariable String namespace, @PathVariable String name) {
        WorkloadRef workload = managed(namespace, name);
        log.info("[AUDIT] Manual evaluation requested for {}", workload);
        return ResponseEntity.ok(orchestrator.evaluate(workload));
    }

    /**
     * Operator reset back to HEALTHY.
     */
    @PostMapping("/{namespace}/{name}/reset")
    public ResponseEntity<WorkloadStatus> reset(@PathVariable String namespace, @PathVariable String name) {
        WorkloadRef workload = managed(namespace, name);
        orchestrator.reset(workload);
        return ResponseEntity.ok(orchestrator.status(workload));
    }

    @GetMapping("/scheduler")
    public ResponseEntity<HealingSchedulerService.SchedulerStats> getSchedulerStats() {
        return ResponseEntity.ok(schedulerService.getStats());
    }

    private WorkloadRef managed(String namespace, String name) {
        WorkloadRef workload = WorkloadRef.of(namespace, name);
        if (properties.findWorkload(workload).isEmpty()) {
            throw ResourceNotFoundException.notManaged(workload.toString());
        }
        return workload;
    }
}
