package org.areaflow.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Body of {@code error} in a failed response. {@code details} carries the rejected item and field
 * for config errors and the offending name for unknown actions and reactions.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String UNKNOWN_REACTION = "UNKNOWN_REACTION";
    public static final String INVALID_CONFIG = "INVALID_CONFIG";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    String code;
    String message;
    Object details;

    public static ApiError of(String code, String message, Object details) {
        return new ApiError(code, message, details);
    }
}
