package com.appdeploy.k8s;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

public enum ResourceKind {
    WORKLOAD("serving.knative.dev", "v1", "Service", "services"),
    DOMAIN_MAPPING("serving.knative.dev", "v1beta1", "DomainMapping", "domainmappings"),
    AUTOSCALER_POLICY("autoscaling.internal.knative.dev", "v1alpha1", "PodAutoscaler", "podautoscalers");

    private final String group;
    private final String version;
    private final String kind;
    private final String plural;

    ResourceKind(String group, String version, String kind, String plural) {
        this.group = group;
        this.version = version;
        this.kind = kind;
        this.plural = plural;
    }

    public String apiVersion() {
        return group + "/" + version;
    }

    public String kind() {
        return kind;
    }

    public ResourceDefinitionContext context() {
        return new ResourceDefinitionContext.Builder()
                .withGroup(group)
                .withVersion(version)
                .withKind(kind)
                .withPlural(plural)
                .withNamespaced(true)
                .build();
    }
}
