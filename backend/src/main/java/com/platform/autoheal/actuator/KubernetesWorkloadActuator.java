package com.platform.autoheal.actuator;

import com.platform.autoheal.config.AutoHealProperties;
import com.platform.autoheal.error.ActuatorException;
import com.platform.autoheal.error.ErrorCode;
import com.platform.autoheal.error.KubernetesErrors;
import com.platform.autoheal.error.ResourceNotFoundException;
import com.platform.autoheal.model.WorkloadRef;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.KubernetesClientTimeoutException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Remediation against Deployments through the Kubernetes API.
 *
 * Restart and rollback edit the pod template the same way {@code kubectl rollout restart} and
 * {@code kubectl rollout undo} do. No call here is retried.
 */
@Slf4j
@Component
public class KubernetesWorkloadActuator implements WorkloadActuator {

    static final String RESTARTED_AT = "kubectl.kubernetes.io/restartedAt";
    static final String REVISION = "deployment.kubernetes.io/revision";
    static final String POD_TEMPLATE_HASH = "pod-template-hash";

    private final KubernetesClient client;
    private final AutoHealProperties properties;
    private final Clock clock;

    public KubernetesWorkloadActuator(KubernetesClient client, AutoHealProperties properties, Clock clock) {
        this.client = client;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ActionResult restart(WorkloadRef workload) {
        long start = System.nanoTime();
        String restartedAt = clock.instant().toString();

        edit(workload, "restart", deployment -> new DeploymentBuilder(deployment)
            .editSpec()
                .editTemplate()
                    .editOrNewMetadata()
                        .addToAnnotations(RESTARTED_AT, restartedAt)
                    .endMetadata()
                .endTemplate()
            .endSpec()
            .build());
        waitForRollout(workload, "restart");

        log.info("[AUDIT] Restarted {} (restartedAt={})", workload, restartedAt);
        return ActionResult.ok("restart", "Rolling restart at " + restartedAt, start);
    }

    @Override
    public ActionResult scale(WorkloadRef workload, int replicas) {
        if (replicas < 0) {
            throw new ActuatorException(ErrorCode.ACTUATOR_FAILED, workload, "scale",
                "Replica count must not be negative: " + replicas);
        }
        long start = System.nanoTime();

        edit(workload, "scale", deployment -> new DeploymentBuilder(deployment)
            .editSpec()
                .withReplicas(replicas)
            .endSpec()
            .build());

        log.info("[AUDIT] Scaled {} to {} replicas", workload, replicas);
        return ActionResult.ok("scale", "Scaled to " + replicas, start);
    }

    @Override
    public ActionResult clearCache(WorkloadRef workload) {
        long start = System.nanoTime();
        Deployment deployment = get(workload, "clear-cache");
        Pod pod = firstRunningPod(workload, deployment);
        String podName = pod.getMetadata().getName();
        String command = properties.getActuator().getCacheClearCommand();

        execInPod(workload, podName, command);
        log.info("[AUDIT] Cleared cache in pod {} of {}", podName, workload);

        restart(workload);
        return ActionResult.ok("clear-cache", "Ran '" + command + "' in " + podName + " and restarted", start);
    }

    @Override
    public ActionResult rollback(WorkloadRef workload) {
        long start = System.nanoTime();
        Deployment deployment = get(workload, "rollback");

        List<ReplicaSet> owned = ownedReplicaSets(workload, deployment);
        long current = currentRevision(deployment, owned);
        ReplicaSet previous = owned.stream()
            .filter(rs -> revisionOf(rs) > 0 && revisionOf(rs) < current)
            .max(Comparator.comparingLong(KubernetesWorkloadActuator::revisionOf))
            .orElseThrow(() -> new ActuatorException(ErrorCode.NO_PREVIOUS_REVISION, workload, "rollback",
                "No revision before " + current + " to roll back " + workload + " to"));

        PodTemplateSpec template = withoutTemplateHash(previous.getSpec().getTemplate());
        edit(workload, "rollback", d -> new DeploymentBuilder(d)
            .editSpec()
                .withTemplate(template)
            .endSpec()
            .build());
        waitForRollout(workload, "rollback");

        long target = revisionOf(previous);
        log.info("[AUDIT] Rolled back {} from revision {} to revision {}", workload, current, target);
        return ActionResult.ok("rollback", "Rolled back to revision " + target, start);
    }

    @Override
    public int desiredReplicas(WorkloadRef workload) {
        Optional<Integer> configured = properties.findWorkload(workload)
            .map(AutoHealProperties.ManagedWorkload::getReplicas);
        if (configured.isPresent()) {
            return configured.get();
        }
        Integer replicas = get(workload, "read-replicas").getSpec().getReplicas();
        return replicas != null ? replicas : 1;
    }

    // ==================== Kubernetes helpers ====================

    private RollableScalableResource<Deployment> deploymentResource(WorkloadRef workload) {
        return client.apps().deployments()
            .inNamespace(workload.namespace())
            .withName(workload.name());
    }

    private Deployment get(WorkloadRef workload, String operation) {
        Deployment deployment;
        try {
            deployment = deploymentResource(workload).get();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, operation, e);
        }
        if (deployment == null) {
            throw ResourceNotFoundException.workload(workload.toString());
        }
        return deployment;
    }

    private void edit(WorkloadRef workload, String operation, UnaryOperator<Deployment> change) {
        get(workload, operation);
        try {
            deploymentResource(workload).edit(change);
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, operation, e);
        }
    }

    private void waitForRollout(WorkloadRef workload, String operation) {
        AutoHealProperties.Actuator config = properties.getActuator();
        if (!config.isWaitForRollout()) {
            return;
        }
        long timeoutSeconds = config.getRolloutTimeout().toSeconds();
        try {
            deploymentResource(workload).waitUntilCondition(
                KubernetesWorkloadActuator::isRolledOut, timeoutSeconds, TimeUnit.SECONDS);
        } catch (KubernetesClientTimeoutException e) {
            throw ActuatorException.rolloutTimeout(workload, operation, timeoutSeconds);
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, operation, e);
        }
    }

    static boolean isRolledOut(Deployment deployment) {
        if (deployment == null || deployment.getStatus() == null) {
            return false;
        }
        DeploymentStatus status = deployment.getStatus();
        Long generation = deployment.getMetadata().getGeneration();
        Long observed = status.getObservedGeneration();
        if (generation != null && (observed == null || observed < generation)) {
            return false;
        }
        int desired = Optional.ofNullable(deployment.getSpec().getReplicas()).orElse(1);
        int updated = Optional.ofNullable(status.getUpdatedReplicas()).orElse(0);
        int available = Optional.ofNullable(status.getAvailableReplicas()).orElse(0);
        int total = Optional.ofNullable(status.getReplicas()).orElse(0);
        return updated >= desired && available >= desired && total <= updated;
    }

    private Pod firstRunningPod(WorkloadRef workload, Deployment deployment) {
        Map<String, String> selector = deployment.getSpec().getSelector() != null
            ? deployment.getSpec().getSelector().getMatchLabels()
            : null;
        if (selector == null || selector.isEmpty()) {
            throw new ActuatorException(ErrorCode.CACHE_CLEAR_FAILED, workload, "clear-cache",
                "Deployment " + workload + " has no label selector");
        }

        List<Pod> pods;
        try {
            pods = client.pods().inNamespace(workload.namespace()).withLabels(selector).list().getItems();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, "clear-cache", e);
        }
        return pods.stream()
            .filter(p -> p.getStatus() != null && "Running".equals(p.getStatus().getPhase()))
            .min(Comparator.comparing(p -> p.getMetadata().getName()))
            .orElseThrow(() -> new ActuatorException(ErrorCode.CACHE_CLEAR_FAILED, workload, "clear-cache",
                "No running pod of " + workload + " to clear the cache in"));
    }

    private void execInPod(WorkloadRef workload, String podName, String command) {
        long timeoutSeconds = properties.getActuator().getExecTimeout().toSeconds();
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        try (ExecWatch watch = client.pods()
                .inNamespace(workload.namespace())
                .withName(podName)
                .writingOutput(stdout)
                .writingError(stderr)
                .exec("sh", "-c", command)) {

            Integer exitCode = watch.exitCode().get(timeoutSeconds, TimeUnit.SECONDS);
            if (exitCode == null || exitCode != 0) {
                throw new ActuatorException(ErrorCode.CACHE_CLEAR_FAILED, workload, "clear-cache",
                    String.format("'%s' in pod %s exited with %s: %s", command, podName, exitCode,
                        stderr.toString(StandardCharsets.UTF_8).trim()));
            }
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, "clear-cache", e);
        } catch (TimeoutException e) {
            throw new ActuatorException(ErrorCode.CACHE_CLEAR_FAILED, workload, "clear-cache",
                String.format("'%s' in pod %s did not finish within %ds", command, podName, timeoutSeconds), e);
        } catch (ExecutionException e) {
            throw ActuatorException.failed(workload, "clear-cache", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ActuatorException.failed(workload, "clear-cache", e);
        }
    }

    private List<ReplicaSet> ownedReplicaSets(WorkloadRef workload, Deployment deployment) {
        Map<String, String> selector = deployment.getSpec().getSelector() != null
            ? deployment.getSpec().getSelector().getMatchLabels()
            : Map.of();
        List<ReplicaSet> replicaSets;
        try {
            replicaSets = client.apps().replicaSets()
                .inNamespace(workload.namespace())
                .withLabels(selector)
                .list()
                .getItems();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.forAction(workload, "rollback", e);
        }
        return replicaSets.stream()
            .filter(rs -> isOwnedBy(rs, deployment))
            .collect(Collectors.toList());
    }

    private static boolean isOwnedBy(ReplicaSet replicaSet, Deployment deployment) {
        List<OwnerReference> owners = replicaSet.getMetadata().getOwnerReferences();
        if (owners == null) {
            return false;
        }
        String uid = deployment.getMetadata().getUid();
        return owners.stream().anyMatch(owner -> "Deployment".equals(owner.getKind())
            && (uid != null && owner.getUid() != null
                ? uid.equals(owner.getUid())
                : Objects.equals(deployment.getMetadata().getName(), owner.getName())));
    }

    private static long currentRevision(Deployment deployment, List<ReplicaSet> owned) {
        long annotated = parseRevision(annotation(deployment.getMetadata().getAnnotations(), REVISION));
        if (annotated > 0) {
            return annotated;
        }
        return owned.stream().mapToLong(KubernetesWorkloadActuator::revisionOf).max().orElse(0);
    }

    static long revisionOf(ReplicaSet replicaSet) {
        return parseRevision(annotation(replicaSet.getMetadata().getAnnotations(), REVISION));
    }

    private static String annotation(Map<String, String> annotations, String key) {
        return annotations != null ? annotations.get(key) : null;
    }

    private static long parseRevision(String raw) {
        if (raw == null) {
            return 0;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static PodTemplateSpec withoutTemplateHash(PodTemplateSpec template) {
        PodTemplateSpec copy = new PodTemplateSpecBuilder(template).build();
        if (copy.getMetadata() != null && copy.getMetadata().getLabels() != null) {
            Map<String, String> labels = new HashMap<>(copy.getMetadata().getLabels());
            labels.remove(POD_TEMPLATE_HASH);
            copy.getMetadata().setLabels(labels);
        }
        return copy;
    }
}
