package com.appdeploy.model;

import java.util.List;

public record AppDetail(
        String name,
        String namespace,
        String image,
        String url,
        List<Condition> conditions
) {
    public static record Condition(
            String type,
            String status,
            String reason,
            String message,
            String lastTransitionTime
    ) {
    }
}
