package com.platform.autoheal.state;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.KubernetesErrors;
import com.platform.autoheal.error.ResourceNotFoundException;
import com.platform.autoheal.error.StateConflictException;
import com.platform.autoheal.model.WorkloadRef;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Healing state kept as annotations on the managed Deployment, so it lives and dies with the
 * workload and needs no database.
 *
 * The compare-and-set checks the {@code version} annotation, then writes with the Deployment's
 * resourceVersion so the check and the write are atomic. A 409 while the token still matches
 * comes from some other writer (a rollout updating the object) and is retried.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "autoheal.state.store", havingValue = "kubernetes", matchIfMissing = true)
public class KubernetesHealingStateStore implements HealingStateStore {

    static final String PREFIX = "autoheal.platform.io/";
    static final String ATTEMPT = PREFIX + "attempt";
    static final String LAST_ACTION = PREFIX + "last-action";
    static final String LAST_UPDATED = PREFIX + "last-updated";
    static final String VERSION = PREFIX + "version";
    static final String IN_FLIGHT = PREFIX + "in-flight";
    static final String LEGACY_ATTEMPT = "healing.attempt";

    private final KubernetesClient client;
    private final int writeRetries;

    public KubernetesHealingStateStore(KubernetesClient client, AutoHealProperties properties) {
        this.client = client;
        this.writeRetries = Math.max(1, properties.getState().getWriteRetries());
    }

    @Override
    public HealingState read(WorkloadRef workload) {
        Deployment deployment = fetch(workload, "read-state");
        return fromAnnotations(workload, annotationsOf(deployment));
    }

    @Override
    public HealingState compareAndSet(HealingState expected, HealingState next) {
        WorkloadRef workload = expected.workload();

        for (int attempt = 1; attempt <= writeRetries; attempt++) {
            Deployment deployment = fetch(workload, "write-state");
            Map<String, String> annotations = new HashMap<>(annotationsOf(deployment));

            String actual = annotations.getOrDefault(VERSION, HealingState.INITIAL_TOKEN);
            if (!actual.equals(expected.versionToken())) {
                throw new StateConflictException(workload, expected.versionToken(), actual);
            }

            HealingState stored = next.withVersionToken(UUID.randomUUID().toString());
            writeAnnotations(stored, annotations);
            deployment.getMetadata().setAnnotations(annotations);

            try {
                client.apps().deployments()
                    .inNamespace(workload.namespace())
                    .resource(deployment)
                    .update();
                log.debug("Stored healing state for {}: attempt={}, version={}",
                    workload, stored.attempt(), stored.versionToken());
                return stored;
            } catch (KubernetesClientException e) {
                if (!KubernetesErrors.isConflict(e)) {
                    throw KubernetesErrors.forState(workload, "write-state", e);
                }
                log.debug("Deployment {} changed underneath the state write (attempt {}/{}), re-reading",
                    workload, attempt, writeRetries);
            }
        }

        throw new StateConflictException(workload, expected.versionToken(), "unknown");
    }

    private Deployment fetch(WorkloadRef workload, String operation) {
        Deployment deployment;
        try {
            deployment = client.apps().deployments()
                .inNamespace(workload.namespace())
                .withName(workload.name())
                .get();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forState(workload, operation, e);
        }
        if (deployment == null) {
            throw ResourceNotFoundException.workload(workload.toString());
        }
        return deployment;
    }

    private static Map<String, String> annotationsOf(Deployment deployment) {
        Map<String, String> annotations = deployment.getMetadata().getAnnotations();
        return annotations != null ? annotations : Map.of();
    }

    static HealingState fromAnnotations(WorkloadRef workload, Map<String, String> annotations) {
        String rawAttempt = annotations.getOrDefault(ATTEMPT, annotations.get(LEGACY_ATTEMPT));
        return HealingState.normalized(
            workload,
            parseAttempt(workload, rawAttempt),
            parseInstant(annotations.get(LAST_UPDATED)),
            annotations.getOrDefault(VERSION, HealingState.INITIAL_TOKEN),
            InFlightClaim.decode(annotations.get(IN_FLIGHT))
        );
    }

    static void writeAnnotations(HealingState state, Map<String, String> annotations) {
        annotations.put(ATTEMPT, String.valueOf(state.attempt()));
        annotations.put(LAST_ACTION, state.lastAction().name());
        annotations.put(VERSION, state.versionToken());
        if (state.lastUpdated() != null) {
            annotations.put(LAST_UPDATED, state.lastUpdated().toString());
        }
        if (state.inFlight() != null) {
            annotations.put(IN_FLIGHT, state.inFlight().encode());
        } else {
            annotations.remove(IN_FLIGHT);
        }
        annotations.remove(LEGACY_ATTEMPT);
    }

    private static int parseAttempt(WorkloadRef workload, String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed attempt annotation '{}' on {}", raw, workload);
            return 0;
        }
    }

    private static Instant parseInstant(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
