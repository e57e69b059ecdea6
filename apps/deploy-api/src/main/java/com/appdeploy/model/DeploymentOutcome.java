package com.appdeploy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentOutcome(
        String name,
        String namespace,
        DeploymentAction action,
        DeploymentStatus status,
        String primaryUrl,
        String secondaryUrl
) {
    public static DeploymentOutcome success(String name, String namespace, DeploymentAction action,
            String primaryUrl, String secondaryUrl) {
        return new DeploymentOutcome(name, namespace, action, DeploymentStatus.SUCCESS, primaryUrl, secondaryUrl);
    }
}
