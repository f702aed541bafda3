package com.platform.autoheal.state;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.PermissionDeniedException;
import com.platform.autoheal.error.StateConflictException;
import com.platform.autoheal.model.WorkloadRef;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Write conflicts reported by the API server, scripted request by request.
 */
@EnableKubernetesMockClient
class KubernetesHealingStateStoreConflictTest {

    private static final WorkloadRef WORKLOAD = WorkloadRef.of("default", "flask-app");
    private static final String PATH = "/apis/apps/v1/namespaces/default/deployments/flask-app";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    KubernetesMockServer server;
    KubernetesClient client;

    private AutoHealProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AutoHealProperties();
    }

    private KubernetesHealingStateStore store() {
        return new KubernetesHealingStateStore(client, properties);
    }

    private static Deployment deployment(String versionToken, String resourceVersion) {
        return new DeploymentBuilder()
            .withNewMetadata()
                .withName(WORKLOAD.name())
                .withNamespace(WORKLOAD.namespace())
                .withResourceVersion(resourceVersion)
                .addToAnnotations(KubernetesHealingStateStore.VERSION, versionToken)
            .endMetadata()
            .withNewSpec().withReplicas(2).endSpec()
            .build();
    }

    private static Status status(int code, String reason) {
        return new StatusBuilder().withCode(code).withReason(reason).withMessage(reason).build();
    }

    private static HealingState seen(String versionToken) {
        return HealingState.normalized(WORKLOAD, 0, null, versionToken, null);
    }

    @Test
    @DisplayName("a conflict from another writer should be retried when the token still matches")
    void retriesForeignConflict() {
        server.expect().get().withPath(PATH).andReturn(200, deployment("v1", "10")).once();
        server.expect().get().withPath(PATH).andReturn(200, deployment("v1", "11")).always();
        server.expect().put().withPath(PATH).andReturn(409, status(409, "Conflict")).once();
        server.expect().put().withPath(PATH).andReturn(200, deployment("v2", "12")).always();

        HealingState stored = store().compareAndSet(seen("v1"), seen("v1").claim(HealingAction.RESTARTED, NOW));

        assertThat(stored.versionToken()).isNotEqualTo("v1");
        assertThat(stored.inFlight().action()).isEqualTo(HealingAction.RESTARTED);
    }

    @Test
    @DisplayName("a conflict caused by a competing state write should be reported as a state conflict")
    void conflictWithChangedToken() {
        server.expect().get().withPath(PATH).andReturn(200, deployment("v1", "10")).once();
        server.expect().get().withPath(PATH).andReturn(200, deployment("v9", "11")).always();
        server.expect().put().withPath(PATH).andReturn(409, status(409, "Conflict")).once();
        server.expect().put().withPath(PATH).andReturn(200, deployment("v2", "12")).always();

        assertThatThrownBy(() -> store().compareAndSet(seen("v1"), seen("v1").claim(HealingAction.RESTARTED, NOW)))
            .isInstanceOf(StateConflictException.class)
            .hasMessageContaining("v9");
    }

    @Test
    @DisplayName("conflicts should be retried only up to the configured number of writes")
    void boundedRetries() {
        properties.getState().setWriteRetries(2);
        server.expect().get().withPath(PATH).andReturn(200, deployment("v1", "10")).always();
        server.expect().put().withPath(PATH).andReturn(409, status(409, "Conflict")).times(2);
        server.expect().put().withPath(PATH).andReturn(200, deployment("v2", "12")).always();

        assertThatThrownBy(() -> store().compareAndSet(seen("v1"), seen("v1").claim(HealingAction.RESTARTED, NOW)))
            .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("a forbidden write should surface as a permission error, not a conflict")
    void forbiddenWrite() {
        server.expect().get().withPath(PATH).andReturn(200, deployment("v1", "10")).always();
        server.expect().put().withPath(PATH).andReturn(403, status(403, "Forbidden")).always();

        assertThatThrownBy(() -> store().compareAndSet(seen("v1"), seen("v1").claim(HealingAction.RESTARTED, NOW)))
            .isInstanceOf(PermissionDeniedException.class);
    }
}
