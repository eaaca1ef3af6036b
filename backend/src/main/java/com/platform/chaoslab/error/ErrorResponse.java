package com.platform.chaoslab.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors return this structure for consistency.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique error code (e.g., CL-302).
     */
    private String code;

    /**
     * Human-readable error message.
     */
    private String message;

    private String detail;

    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    /**
     * Request path that caused the error.
     */
    private String path;

    /**
     * Trace ID for correlating with logs.
     */
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("field_errors")
    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    /**
     * Field-level validation error.
     */
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        @JsonProperty("rejected_value")
        private Object rejectedValue;
    }
}
