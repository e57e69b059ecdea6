package com.appdeploy.k8s.impl;

import com.appdeploy.k8s.ControlPlaneException;
import com.appdeploy.k8s.ControlPlaneGateway;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.k8s.UpsertResult;
import com.appdeploy.model.DeploymentAction;
import com.appdeploy.model.PodSummary;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.HttpURLConnection;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class DefaultControlPlaneGateway implements ControlPlaneGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultControlPlaneGateway.class);

    private static final PatchContext MERGE_PATCH = PatchContext.of(PatchType.JSON_MERGE);

    private final KubernetesClient client;

    @Inject
    public DefaultControlPlaneGateway(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<GenericKubernetesResource> get(ResourceKind kind, String namespace, String name) {
        try {
            return Optional.ofNullable(collection(kind).inNamespace(namespace).withName(name).get());
        } catch (KubernetesClientException ex) {
            if (ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return Optional.empty();
            }
            throw translate("get", kind, namespace, name, ex);
        }
    }

    @Override
    public List<GenericKubernetesResource> list(ResourceKind kind, String namespace) {
        GenericKubernetesResourceList result = call("list", kind, namespace, "*",
                () -> collection(kind).inNamespace(namespace).list());
        return Optional.ofNullable(result)
                .map(GenericKubernetesResourceList::getItems)
                .orElse(List.of());
    }

    @Override
    public UpsertResult createOrReplace(ResourceKind kind, String namespace, String name,
            GenericKubernetesResource desired) {
        if (get(kind, namespace, name).isEmpty()) {
            LOGGER.info("Creating {} {}/{}", kind.kind(), namespace, name);
            return new UpsertResult(DeploymentAction.CREATED, create(kind, namespace, desired));
        }
        LOGGER.info("Replacing {} {}/{} with the desired document", kind.kind(), namespace, name);
        return new UpsertResult(DeploymentAction.UPDATED, patch(kind, namespace, name, desired));
    }

    @Override
    public GenericKubernetesResource create(ResourceKind kind, String namespace, GenericKubernetesResource desired) {
        String name = desired.getMetadata() != null ? desired.getMetadata().getName() : null;
        return call("create", kind, namespace, name,
                () -> collection(kind).inNamespace(namespace).resource(desired).create());
    }

    @Override
    public GenericKubernetesResource patch(ResourceKind kind, String namespace, String name,
            GenericKubernetesResource patch) {
        return call("patch", kind, namespace, name,
                () -> collection(kind).inNamespace(namespace).withName(name).patch(MERGE_PATCH, patch));
    }

    @Override
    public boolean delete(ResourceKind kind, String namespace, String name) {
        try {
            List<StatusDetails> details = collection(kind).inNamespace(namespace).withName(name).delete();
            return details != null && !details.isEmpty();
        } catch (KubernetesClientException ex) {
            if (ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return false;
            }
            throw translate("delete", kind, namespace, name, ex);
        }
    }

    @Override
    public List<PodSummary> listPods(String namespace, Map<String, String> selector) {
        List<Pod> pods;
        try {
            var op = client.pods().inNamespace(namespace);
            var target = (selector != null && !selector.isEmpty()) ? op.withLabels(selector) : op;
            pods = Optional.ofNullable(target.list())
                    .map(list -> list.getItems())
                    .orElse(List.of());
        } catch (KubernetesClientException ex) {
            throw new ControlPlaneException(ex.getCode(), reasonOf(ex), ex);
        }
        return pods.stream()
                .map(pod -> new PodSummary(
                        pod.getMetadata().getName(),
                        pod.getMetadata().getNamespace(),
                        Optional.ofNullable(pod.getStatus()).map(status -> status.getPhase()).orElse("Unknown"),
                        parseTimestamp(pod.getMetadata().getCreationTimestamp()),
                        Optional.ofNullable(pod.getSpec())
                                .map(spec -> spec.getContainers())
                                .orElse(List.of())
                                .stream()
                                .map(Container::getName)
                                .toList()))
                .sorted(Comparator.comparing(PodSummary::name))
                .toList();
    }

    @Override
    public String readLogs(String namespace, String pod, String container, int tailLines) {
        try {
            var podResource = client.pods().inNamespace(namespace).withName(pod);
            String log = (container == null || container.isBlank())
                    ? podResource.tailingLines(tailLines).getLog()
                    : podResource.inContainer(container).tailingLines(tailLines).getLog();
            return log == null ? "" : log;
        } catch (KubernetesClientException ex) {
            throw new ControlPlaneException(ex.getCode(), reasonOf(ex), ex);
        }
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> collection(
            ResourceKind kind) {
        return client.genericKubernetesResources(kind.context());
    }

    private <T> T call(String operation, ResourceKind kind, String namespace, String name, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubernetesClientException ex) {
            throw translate(operation, kind, namespace, name, ex);
        }
    }

    private ControlPlaneException translate(String operation, ResourceKind kind, String namespace, String name,
            KubernetesClientException ex) {
        String reason = reasonOf(ex);
        LOGGER.warn("Control plane {} of {} {}/{} failed: {} - {}", operation, kind.kind(), namespace, name,
                ex.getCode(), reason);
        return new ControlPlaneException(ex.getCode(), reason, ex);
    }

    private String reasonOf(KubernetesClientException ex) {
        return Optional.ofNullable(ex.getStatus())
                .map(Status::getReason)
                .filter(reason -> !reason.isBlank())
                .orElseGet(() -> Optional.ofNullable(ex.getMessage()).orElse("unknown"));
    }

    private Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Unable to parse timestamp {}: {}", value, ex.getMessage());
            return null;
        }
    }
}
