package com.e2eq.restcore.rest;

import com.e2eq.restcore.exceptions.BasicErrorCodes;
import com.e2eq.restcore.exceptions.RestApiException;
import com.e2eq.restcore.model.validation.SimpleValidator;
import com.e2eq.restcore.model.validation.ValidationResult;
import com.e2eq.restcore.model.validation.ValidationSchema;
import com.e2eq.restcore.util.ExceptionLoggingUtils;
import com.e2eq.restcore.util.JSONUtils;
import com.e2eq.restcore.util.ParseUtils;
import jakarta.ws.rs.core.MediaType;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request body and parameter helpers shared by resources. Failures are raised as
 * {@link RestApiException} so they reach the client through the exception mapper.
 */
public final class RequestUtils {

    private RequestUtils() {
    }

    /**
     * Runs the schema over the request data.
     *
     * @return the accepted values
     * @throws RestApiException 400 VALIDATION_ERROR with the per-field errors as details
     */
    public static Map<String, Object> validate(Object data, ValidationSchema schema) {
        ValidationResult result = SimpleValidator.validate(data, schema);
        if (result.hasErrors()) {
            throw RestApiException.badRequest(BasicErrorCodes.VALIDATION_ERROR, result.getErrorDetails());
        }
        return result.getResult();
    }

    @Nullable
    public static UUID tryParseUuid(@Nullable String text, boolean raiseError) {
        UUID uuid = ParseUtils.parseUuid(text);
        if (uuid == null && raiseError) {
            throw RestApiException.badRequest(BasicErrorCodes.BAD_UUID);
        }
        return uuid;
    }

    public static UUID tryParseUuid(@Nullable String text) {
        return tryParseUuid(text, true);
    }

    /**
     * Parses a JSON object body. An empty body is an empty map.
     *
     * @throws RestApiException 400 INVALID_CONTENT when the body is not a JSON object
     */
    public static Map<String, Object> processJsonBody(@Nullable byte[] body) {
        if (body == null || body.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = JSONUtils.instance().readMap(body);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (IOException e) {
            ExceptionLoggingUtils.logDebug(e, "Rejected request body");
            throw RestApiException.badRequest(BasicErrorCodes.INVALID_CONTENT);
        }
    }

    /**
     * Body of a write request, which must be declared as JSON.
     *
     * @throws RestApiException 406 INVALID_CONTENT for any other content type
     */
    public static Map<String, Object> processJsonRequest(@Nullable String contentType, @Nullable byte[] body) {
        if (!StringUtils.containsIgnoreCase(contentType, MediaType.APPLICATION_JSON)) {
            throw RestApiException.notAcceptable(BasicErrorCodes.INVALID_CONTENT, contentType);
        }
        return processJsonBody(body);
    }

    /**
     * Last value of a request parameter, or null.
     */
    @Nullable
    public static String lastValue(@Nullable Map<String, List<String>> params, String name) {
        if (params == null) {
            return null;
        }
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    public static Boolean getBoolParam(@Nullable Map<String, List<String>> params, String name, @Nullable Boolean defaultValue) {
        return ParseUtils.parseBool(lastValue(params, name), defaultValue);
    }

    public static Long getDateUnixParam(@Nullable Map<String, List<String>> params, String name, @Nullable Long defaultValue) {
        return ParseUtils.parseDateToUnixTs(lastValue(params, name), defaultValue);
    }
}
