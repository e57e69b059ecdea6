package com.appdeploy.api;

import com.appdeploy.apps.AppCatalog;
import com.appdeploy.deploy.DeploymentOrchestrator;
import com.appdeploy.edge.EdgeGateway;
import com.appdeploy.model.AppDetail;
import com.appdeploy.model.AppList;
import com.appdeploy.model.DeletionAck;
import com.appdeploy.model.TrafficSummary;
import com.appdeploy.spec.ResourceSpecBuilder;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

@Path("/apps")
@Produces(MediaType.APPLICATION_JSON)
public class AppResource {

    static final Duration DEFAULT_ANALYTICS_WINDOW = Duration.ofHours(24);

    @Inject
    AppCatalog catalog;

    @Inject
    DeploymentOrchestrator orchestrator;

    @Inject
    EdgeGateway edge;

    @Inject
    ResourceSpecBuilder specs;

    @GET
    public AppList list(@QueryParam("namespace") String namespace) {
        return catalog.list(orchestrator.resolveNamespace(namespace));
    }

    @GET
    @Path("/{namespace}/{name}")
    public AppDetail get(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        return catalog.get(namespace, name);
    }

    @DELETE
    @Path("/{namespace}/{name}")
    public DeletionAck delete(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        return orchestrator.delete(namespace, name);
    }

    @GET
    @Path("/{namespace}/{name}/analytics")
    public TrafficSummary analytics(@PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @QueryParam("from") String from,
            @QueryParam("to") String to) {
        catalog.get(namespace, name);
        Instant toInstant = parseInstant(to, Instant.now());
        Instant fromInstant = parseInstant(from, toInstant.minus(DEFAULT_ANALYTICS_WINDOW));
        if (!fromInstant.isBefore(toInstant)) {
            throw new BadRequestException("from must be before to");
        }
        return edge.queryTraffic(fromInstant, toInstant, specs.primaryHostname(name));
    }

    private Instant parseInstant(String value, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Invalid timestamp: " + value);
        }
    }
}
