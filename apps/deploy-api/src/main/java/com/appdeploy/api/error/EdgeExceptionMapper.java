package com.appdeploy.api.error;

import com.appdeploy.edge.EdgeException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class EdgeExceptionMapper implements ExceptionMapper<EdgeException> {

    @Override
    public Response toResponse(EdgeException exception) {
        return Response.status(Response.Status.BAD_GATEWAY)
                .entity(new ErrorResponse(exception.getMessage()))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }
}
