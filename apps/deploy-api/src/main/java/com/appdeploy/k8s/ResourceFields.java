package com.appdeploy.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// path elements are map keys, or list indexes when given as Integer
public final class ResourceFields {

    private ResourceFields() {
    }

    public static Optional<Object> path(GenericKubernetesResource resource, Object... path) {
        if (resource == null || path.length == 0) {
            return Optional.empty();
        }
        Object current = resource.getAdditionalProperties().get(String.valueOf(path[0]));
        for (int i = 1; i < path.length && current != null; i++) {
            current = step(current, path[i]);
        }
        return Optional.ofNullable(current);
    }

    public static Optional<String> string(GenericKubernetesResource resource, Object... path) {
        return path(resource, path)
                .filter(String.class::isInstance)
                .map(String.class::cast);
    }

    public static Optional<Long> number(GenericKubernetesResource resource, Object... path) {
        return path(resource, path)
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).longValue());
    }

    public static List<Map<String, Object>> maps(GenericKubernetesResource resource, Object... path) {
        Optional<Object> value = path(resource, path);
        if (value.isEmpty() || !(value.get() instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
                result.add(copy);
            }
        }
        return result;
    }

    private static Object step(Object current, Object key) {
        if (key instanceof Integer index) {
            if (current instanceof List<?> list && index >= 0 && index < list.size()) {
                return list.get(index);
            }
            return null;
        }
        if (current instanceof Map<?, ?> map) {
            return map.get(String.valueOf(key));
        }
        return null;
    }
}
