package com.appdeploy.api;

import com.appdeploy.deploy.DeploymentOrchestrator;
import com.appdeploy.model.DeploymentOutcome;
import com.appdeploy.model.DeploymentRequest;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/deploy")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class DeploymentResource {

    @Inject
    DeploymentOrchestrator orchestrator;

    @POST
    public DeploymentOutcome deploy(@Valid @NotNull DeploymentRequest request) {
        return orchestrator.deploy(request);
    }
}
