package com.appdeploy.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Map;

public record DeploymentRequest(
        @NotBlank
        @Size(max = 63)
        @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?", message = "must be a DNS label")
        String name,
        @NotBlank
        String image,
        @JsonAlias("envs")
        Map<String, String> environment,
        @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?", message = "must be a DNS label")
        String namespace,
        @JsonAlias("custom_domain")
        @Pattern(regexp = "([a-z0-9]([-a-z0-9]*[a-z0-9])?\\.)+[a-z0-9]([-a-z0-9]*[a-z0-9])?",
                message = "must be a fully-qualified hostname")
        String customDomain
) {
    public DeploymentRequest {
        environment = environment == null ? Map.of() : new LinkedHashMap<>(environment);
    }

    public boolean hasCustomDomain() {
        return customDomain != null && !customDomain.isBlank();
    }
}
