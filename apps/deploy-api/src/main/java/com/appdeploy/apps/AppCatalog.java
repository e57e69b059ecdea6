package com.appdeploy.apps;

import com.appdeploy.deploy.AppNotFoundException;
import com.appdeploy.k8s.ControlPlaneGateway;
import com.appdeploy.k8s.ResourceFields;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.model.AppDetail;
import com.appdeploy.model.AppList;
import com.appdeploy.model.AppSummary;
import com.appdeploy.spec.ResourceSpecBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class AppCatalog {

    static final String UNKNOWN_IMAGE = "unknown";

    @Inject
    ControlPlaneGateway controlPlane;

    @Inject
    ResourceSpecBuilder specs;

    @ConfigProperty(name = "deploy.apps.hidden", defaultValue = "deploy-api,scheduler-api")
    Set<String> hidden = Set.of();

    public AppList list(String namespace) {
        List<AppSummary> apps = controlPlane.list(ResourceKind.WORKLOAD, namespace).stream()
                .filter(item -> item.getMetadata() != null && item.getMetadata().getName() != null)
                .filter(item -> !hidden.contains(item.getMetadata().getName()))
                .map(item -> new AppSummary(
                        item.getMetadata().getName(),
                        Objects.requireNonNullElse(item.getMetadata().getNamespace(), namespace),
                        specs.primaryUrl(item.getMetadata().getName()),
                        isReady(item),
                        imageOf(item)))
                .sorted(Comparator.comparing(AppSummary::name))
                .toList();
        return AppList.of(apps);
    }

    public AppDetail get(String namespace, String name) {
        GenericKubernetesResource item = controlPlane.get(ResourceKind.WORKLOAD, namespace, name)
                .orElseThrow(() -> new AppNotFoundException(name, namespace));
        List<AppDetail.Condition> conditions = ResourceFields.maps(item, "status", "conditions").stream()
                .map(condition -> new AppDetail.Condition(
                        text(condition, "type"),
                        text(condition, "status"),
                        text(condition, "reason"),
                        text(condition, "message"),
                        text(condition, "lastTransitionTime")))
                .toList();
        return new AppDetail(
                item.getMetadata().getName(),
                Objects.requireNonNullElse(item.getMetadata().getNamespace(), namespace),
                imageOf(item),
                specs.primaryUrl(name),
                conditions);
    }

    static boolean isReady(GenericKubernetesResource item) {
        return ResourceFields.maps(item, "status", "conditions").stream()
                .anyMatch(condition -> "Ready".equals(condition.get("type"))
                        && "True".equals(condition.get("status")));
    }

    static String imageOf(GenericKubernetesResource item) {
        return ResourceFields.string(item, "spec", "template", "spec", "containers", 0, "image")
                .orElse(UNKNOWN_IMAGE);
    }

    private static String text(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }
}
