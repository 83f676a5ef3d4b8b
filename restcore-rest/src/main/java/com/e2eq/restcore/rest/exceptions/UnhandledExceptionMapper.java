package com.e2eq.restcore.rest.exceptions;

import com.e2eq.restcore.rest.models.RestErrorResponse;
import com.e2eq.restcore.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class UnhandledExceptionMapper implements ExceptionMapper<Exception> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        ExceptionLoggingUtils.logError(exception, "An unexpected / uncaught exception occurred on %s",
                RestApiExceptionMapper.requestUri(uriInfo));

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(buildBody(exception))
                .build();
    }

    /**
     * The exception type is reported, never its message or trace.
     */
    public static RestErrorResponse buildBody(Exception exception) {
        return RestErrorResponse.builder()
                .errorCode(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode())
                .message(Response.Status.INTERNAL_SERVER_ERROR.getReasonPhrase())
                .details(exception.getClass().getSimpleName())
                .build();
    }
}
