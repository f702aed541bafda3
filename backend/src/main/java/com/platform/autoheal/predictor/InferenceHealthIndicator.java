package com.platform.autoheal.predictor;

import com.platform.autoheal.model.InferenceHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the inference service in {@code /actuator/health}. A down inference service does not
 * stop healing (the fallback heuristic takes over), so this is informational.
 */
@Component("inference")
@RequiredArgsConstructor
public class InferenceHealthIndicator implements HealthIndicator {

    private final InferenceHealthClient client;

    @Override
    public Health health() {
        InferenceHealth health = client.check();
        Health.Builder builder = health.isServing() ? Health.up() : Health.down();
        builder.withDetail("status", String.valueOf(health.status()))
            .withDetail("modelLoaded", health.modelLoaded());
        if (health.modelError() != null) {
            builder.withDetail("modelError", health.modelError());
        }
        return builder.build();
    }
}
