package com.appdeploy.model;

public record AppSummary(
        String name,
        String namespace,
        String url,
        boolean ready,
        String image
) {
}
