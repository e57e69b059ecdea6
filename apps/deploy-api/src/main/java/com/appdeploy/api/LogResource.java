package com.appdeploy.api;

import com.appdeploy.deploy.DeploymentOrchestrator;
import com.appdeploy.logs.LogRetrievalService;
import com.appdeploy.model.LogResult;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

@Path("/logs")
@Produces(MediaType.APPLICATION_JSON)
public class LogResource {

    @Inject
    LogRetrievalService logs;

    @Inject
    DeploymentOrchestrator orchestrator;

    @GET
    @Path("/{name}")
    public LogResult logs(@PathParam("name") String name,
            @QueryParam("namespace") String namespace,
            @QueryParam("tail_lines") @DefaultValue("100") @Min(1) @Max(10000) int tailLines) {
        return logs.getLogs(orchestrator.resolveNamespace(namespace), name, tailLines);
    }
}
