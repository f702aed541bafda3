package com.platform.autoheal.api;

import com.platform.autoheal.model.InferenceHealth;
import com.platform.autoheal.predictor.InferenceHealthClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for collaborator health.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final InferenceHealthClient inferenceHealthClient;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    /**
     * Inference service health document, 503 when it is not serving.
     */
    @GetMapping("/inference")
    public ResponseEntity<InferenceHealth> getInferenceHealth() {
        InferenceHealth health = inferenceHealthClient.check();
        HttpStatus status = health.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, String>> getCircuitBreakers() {
        CircuitBreaker predictor = circuitBreakerRegistry.circuitBreaker("predictor");
        return ResponseEntity.ok(Map.of(predictor.getName(), predictor.getState().name()));
    }
}
