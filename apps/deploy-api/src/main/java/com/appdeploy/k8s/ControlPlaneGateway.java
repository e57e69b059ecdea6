package com.appdeploy.k8s;

import com.appdeploy.model.PodSummary;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ControlPlaneGateway {

    Optional<GenericKubernetesResource> get(ResourceKind kind, String namespace, String name);

    List<GenericKubernetesResource> list(ResourceKind kind, String namespace);

    UpsertResult createOrReplace(ResourceKind kind, String namespace, String name, GenericKubernetesResource desired);

    GenericKubernetesResource create(ResourceKind kind, String namespace, GenericKubernetesResource desired);

    GenericKubernetesResource patch(ResourceKind kind, String namespace, String name, GenericKubernetesResource patch);

    boolean delete(ResourceKind kind, String namespace, String name);

    List<PodSummary> listPods(String namespace, Map<String, String> selector);

    String readLogs(String namespace, String pod, String container, int tailLines);
}
