package com.e2eq.restcore.rest.exceptions;

import com.e2eq.restcore.config.RestCoreConfig;
import com.e2eq.restcore.exceptions.RestApiException;
import com.e2eq.restcore.rest.models.RestErrorResponse;
import com.e2eq.restcore.util.ExceptionLoggingUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.List;

/**
 * Maps {@link RestApiException} to its status and the standard error body.
 */
@Provider
public class RestApiExceptionMapper implements ExceptionMapper<RestApiException> {

    private final RestCoreConfig.Logging logging;

    @Context
    UriInfo uriInfo;

    @Inject
    public RestApiExceptionMapper(RestCoreConfig config) {
        this(config.logging());
    }

    public RestApiExceptionMapper(RestCoreConfig.Logging logging) {
        this.logging = logging;
    }

    @Override
    public Response toResponse(RestApiException exception) {
        int status = exception.getStatus();
        if (shouldLog(logging, status)) {
            ExceptionLoggingUtils.logError(exception, "Request %s failed with %d", requestUri(uriInfo), status);
        } else {
            ExceptionLoggingUtils.logDebug(exception, "Request %s failed with %d", requestUri(uriInfo), status);
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(buildBody(exception))
                .build();
    }

    public static RestErrorResponse buildBody(RestApiException exception) {
        return RestErrorResponse.builder()
                .errorCode(exception.getErrorCode())
                .message(exception.getErrorEntry().getMessage())
                .details(exception.getDetails())
                .build();
    }

    /**
     * Server errors are always logged, other statuses only when listed in the exception codes.
     */
    static boolean shouldLog(RestCoreConfig.Logging logging, int status) {
        if (status >= 500) {
            return true;
        }
        if (logging == null || !logging.exceptionsEnabled()) {
            return false;
        }
        List<Integer> codes = logging.exceptionsCodes();
        return codes != null && codes.contains(status);
    }

    static String requestUri(UriInfo uriInfo) {
        return uriInfo == null ? "<unknown>" : String.valueOf(uriInfo.getRequestUri());
    }
}
