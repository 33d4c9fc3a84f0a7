package org.tabbit.server;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every API failure.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(String code, String message, Map<String, Object> details) {

    public ApiErrorResponse(String code, String message) {
        this(code, message, Map.of());
    }
}
