package com.appdeploy.k8s;

import com.appdeploy.model.DeploymentAction;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

public record UpsertResult(DeploymentAction action, GenericKubernetesResource resource) {
}
