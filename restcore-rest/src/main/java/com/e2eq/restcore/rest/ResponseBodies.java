package com.e2eq.restcore.rest;

import com.e2eq.restcore.model.persistent.commands.CountedListResult;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Success bodies: the payload plus {@code status: "OK"} and, for lists, {@code totalCount}.
 */
public final class ResponseBodies {
    public static final String STATUS = "status";
    public static final String STATUS_OK = "OK";
    public static final String TOTAL_COUNT = "totalCount";

    private ResponseBodies() {
    }

    public static Map<String, Object> ok() {
        return ok(Map.of(), null);
    }

    public static Map<String, Object> ok(@Nullable Map<String, ?> body) {
        return ok(body, null);
    }

    public static Map<String, Object> ok(@Nullable Map<String, ?> body, @Nullable Long totalCount) {
        Map<String, Object> response = body == null ? new LinkedHashMap<>() : new LinkedHashMap<>(body);
        response.put(STATUS, STATUS_OK);
        if (totalCount != null) {
            response.put(TOTAL_COUNT, totalCount);
        }
        return response;
    }

    /**
     * List body with the rows under {@code dataKey}.
     */
    public static Map<String, Object> ok(String dataKey, CountedListResult list) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(dataKey, list.getResult().getData());
        return ok(body, list.getTotalCount());
    }
}
