package com.appdeploy.api.error;

import com.appdeploy.k8s.ControlPlaneException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ControlPlaneExceptionMapper implements ExceptionMapper<ControlPlaneException> {

    @Override
    public Response toResponse(ControlPlaneException exception) {
        int status = exception.statusCode() >= 400 && exception.statusCode() < 600
                ? exception.statusCode()
                : Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
        return Response.status(status)
                .entity(new ErrorResponse(exception.reason()))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }
}
