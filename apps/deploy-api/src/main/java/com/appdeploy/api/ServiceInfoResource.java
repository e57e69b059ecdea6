package com.appdeploy.api;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class ServiceInfoResource {

    @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown")
    String version;

    @GET
    public Map<String, Object> describe() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("deploy", "/deploy (POST)");
        endpoints.put("list", "/apps (GET)");
        endpoints.put("get", "/apps/{namespace}/{name} (GET)");
        endpoints.put("delete", "/apps/{namespace}/{name} (DELETE)");
        endpoints.put("analytics", "/apps/{namespace}/{name}/analytics (GET)");
        endpoints.put("logs", "/logs/{name} (GET)");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", "Deployment API");
        info.put("version", version);
        info.put("platform", "Knative Serving");
        info.put("endpoints", endpoints);
        return info;
    }
}
