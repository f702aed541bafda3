package com.platform.autoheal.actuator;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.ActuatorException;
import com.platform.autoheal.error.ErrorCode;
import com.platform.autoheal.error.ResourceNotFoundException;
import com.platform.autoheal.model.WorkloadRef;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnableKubernetesMockClient(crud = true)
class KubernetesWorkloadActuatorTest {

    private static final WorkloadRef WORKLOAD = WorkloadRef.of("default", "flask-app");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    KubernetesClient client;

    private AutoHealProperties properties;
    private KubernetesWorkloadActuator actuator;

    @BeforeEach
    void setUp() {
        properties = new AutoHealProperties();
        properties.getActuator().setWaitForRollout(false);
        actuator = new KubernetesWorkloadActuator(client, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PodTemplateSpec template(String image, String hash) {
        return new PodTemplateSpecBuilder()
            .withNewMetadata()
                .addToLabels("app", WORKLOAD.name())
                .addToLabels(KubernetesWorkloadActuator.POD_TEMPLATE_HASH, hash)
            .endMetadata()
            .withNewSpec()
                .addNewContainer().withName("app").withImage(image).endContainer()
            .endSpec()
            .build();
    }

    private Deployment createDeployment(int replicas, String revision, String image) {
        Deployment deployment = new DeploymentBuilder()
            .withNewMetadata()
                .withName(WORKLOAD.name())
                .withNamespace(WORKLOAD.namespace())
                .addToAnnotations(KubernetesWorkloadActuator.REVISION, revision)
            .endMetadata()
            .withNewSpec()
                .withReplicas(replicas)
                .withNewSelector().addToMatchLabels("app", WORKLOAD.name()).endSelector()
                .withNewTemplate()
                    .withNewMetadata().addToLabels("app", WORKLOAD.name()).endMetadata()
                    .withNewSpec()
                        .addNewContainer().withName("app").withImage(image).endContainer()
                    .endSpec()
                .endTemplate()
            .endSpec()
            .build();
        return client.apps().deployments().inNamespace(WORKLOAD.namespace()).resource(deployment).create();
    }

    private void createReplicaSet(Deployment owner, String revision, String image, String hash) {
        client.apps().replicaSets().inNamespace(WORKLOAD.namespace()).resource(new ReplicaSetBuilder()
            .withNewMetadata()
                .withName(WORKLOAD.name() + "-" + hash)
                .withNamespace(WORKLOAD.namespace())
                .addToLabels("app", WORKLOAD.name())
                .addToLabels(KubernetesWorkloadActuator.POD_TEMPLATE_HASH, hash)
                .addToAnnotations(KubernetesWorkloadActuator.REVISION, revision)
                .addNewOwnerReference()
                    .withApiVersion("apps/v1")
                    .withKind("Deployment")
                    .withName(owner.getMetadata().getName())
                    .withUid(owner.getMetadata().getUid())
                .endOwnerReference()
            .endMetadata()
            .withNewSpec()
                .withReplicas(0)
                .withNewSelector().addToMatchLabels("app", WORKLOAD.name()).endSelector()
                .withTemplate(template(image, hash))
            .endSpec()
            .build()).create();
    }

    private Deployment current() {
        return client.apps().deployments().inNamespace(WORKLOAD.namespace()).withName(WORKLOAD.name()).get();
    }

    @Test
    @DisplayName("restart should stamp the pod template like kubectl rollout restart")
    void restartStampsTemplate() {
        createDeployment(2, "1", "flask-app:1");

        ActionResult result = actuator.restart(WORKLOAD);

        assertThat(result.success()).isTrue();
        assertThat(current().getSpec().getTemplate().getMetadata().getAnnotations())
            .containsEntry(KubernetesWorkloadActuator.RESTARTED_AT, NOW.toString());
    }

    @Test
    @DisplayName("scale should set the replica count")
    void scaleSetsReplicas() {
        createDeployment(1, "1", "flask-app:1");

        actuator.scale(WORKLOAD, 3);

        assertThat(current().getSpec().getReplicas()).isEqualTo(3);
    }

    @Test
    @DisplayName("desired replicas should prefer configuration over the live Deployment")
    void desiredReplicas() {
        createDeployment(4, "1", "flask-app:1");
        assertThat(actuator.desiredReplicas(WORKLOAD)).isEqualTo(4);

        AutoHealProperties.ManagedWorkload managed = new AutoHealProperties.ManagedWorkload();
        managed.setName(WORKLOAD.name());
        managed.setReplicas(2);
        properties.getWorkloads().add(managed);

        assertThat(actuator.desiredReplicas(WORKLOAD)).isEqualTo(2);
    }

    @Test
    @DisplayName("acting on a missing deployment should raise not found")
    void missingDeployment() {
        assertThatThrownBy(() -> actuator.restart(WORKLOAD)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("rollback should restore the previous revision's template without its hash label")
    void restoresPreviousTemplate() {
        Deployment deployment = createDeployment(2, "3", "flask-app:3");
        createReplicaSet(deployment, "1", "flask-app:1", "aaa111");
        createReplicaSet(deployment, "2", "flask-app:2", "bbb222");
        createReplicaSet(deployment, "3", "flask-app:3", "ccc333");

        ActionResult result = actuator.rollback(WORKLOAD);

        PodTemplateSpec restored = current().getSpec().getTemplate();
        assertThat(restored.getSpec().getContainers().get(0).getImage()).isEqualTo("flask-app:2");
        assertThat(restored.getMetadata().getLabels())
            .containsEntry("app", WORKLOAD.name())
            .doesNotContainKey(KubernetesWorkloadActuator.POD_TEMPLATE_HASH);
        assertThat(result.message()).contains("revision 2");
    }

    @Test
    @DisplayName("rollback should fail when there is no earlier revision")
    void noPreviousRevision() {
        Deployment deployment = createDeployment(2, "1", "flask-app:1");
        createReplicaSet(deployment, "1", "flask-app:1", "aaa111");

        assertThatThrownBy(() -> actuator.rollback(WORKLOAD))
            .isInstanceOf(ActuatorException.class)
            .satisfies(e -> assertThat(((ActuatorException) e).getErrorCode()).isEqualTo(ErrorCode.NO_PREVIOUS_REVISION));
        assertThat(current().getSpec().getTemplate().getSpec().getContainers().get(0).getImage())
            .isEqualTo("flask-app:1");
    }

    @Test
    @DisplayName("cache clear without a running pod should fail without restarting")
    void cacheClearNeedsRunningPod() {
        createDeployment(2, "1", "flask-app:1");

        assertThatThrownBy(() -> actuator.clearCache(WORKLOAD))
            .isInstanceOf(ActuatorException.class)
            .satisfies(e -> assertThat(((ActuatorException) e).getErrorCode()).isEqualTo(ErrorCode.CACHE_CLEAR_FAILED));
        assertThat(current().getSpec().getTemplate().getMetadata().getAnnotations()).isNullOrEmpty();
    }

    @Test
    @DisplayName("rollout should count as complete only when every replica is updated and available")
    void rolloutCompletion() {
        Deployment rolling = new DeploymentBuilder()
            .withNewMetadata().withName("x").withGeneration(4L).endMetadata()
            .withNewSpec().withReplicas(2).endSpec()
            .withNewStatus()
                .withObservedGeneration(4L)
                .withReplicas(3)
                .withUpdatedReplicas(2)
                .withAvailableReplicas(2)
            .endStatus()
            .build();
        Deployment done = new DeploymentBuilder(rolling)
            .editStatus().withReplicas(2).endStatus()
            .build();
        Deployment stale = new DeploymentBuilder(done)
            .editStatus().withObservedGeneration(3L).endStatus()
            .build();

        assertThat(KubernetesWorkloadActuator.isRolledOut(rolling)).isFalse();
        assertThat(KubernetesWorkloadActuator.isRolledOut(done)).isTrue();
        assertThat(KubernetesWorkloadActuator.isRolledOut(stale)).isFalse();
    }
}
