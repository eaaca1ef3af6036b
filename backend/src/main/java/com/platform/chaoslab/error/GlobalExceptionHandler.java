package com.platform.chaoslab.error;

import com.platform.chaoslab.observability.LoggingConfig;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 *
 * Converts exceptions to standardized ErrorResponse and logs every one of
 * them. Injected faults never reach this class: the inject endpoint reports
 * them in its response body, and experiment runs catch them per tick.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ==================== Chaos Lab Exceptions ====================

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Resource not found: {} ({})",
            traceId, ex.getResourceType(), ex.getResourceId());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resource_type", ex.getResourceType(),
                "resource_id", ex.getResourceId()
            ))
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());

        ErrorResponse.ErrorResponseBuilder builder = baseResponse(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST, request, traceId);

        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }

        return ResponseEntity.badRequest().body(builder.build());
    }

    @ExceptionHandler(FaultConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleFaultConfiguration(
            FaultConfigurationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Fault configuration error: {}", traceId, ex.getMessage());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.BAD_REQUEST, request, traceId)
            .metadata(Map.of(
                "fault_type", ex.getFaultType().getValue(),
                "field", ex.getField()
            ))
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(InvalidExperimentStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(
            InvalidExperimentStateException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Rejected state transition: {}", traceId, ex.getMessage());

        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.CONFLICT, request, traceId)
            .metadata(Map.of(
                "experiment_id", ex.getExperimentId(),
                "current_status", ex.getCurrentStatus().getValue(),
                "requested_status", ex.getRequestedStatus().getValue()
            ))
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(ChaosLabException.class)
    public ResponseEntity<ErrorResponse> handleChaosLabException(
            ChaosLabException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        logError(ex, errorCode, traceId);

        ErrorResponse response = baseResponse(errorCode, ex.getMessage(), status, request, traceId).build();
        return ResponseEntity.status(status).body(response);
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();

        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());

        ErrorResponse response = baseResponse(ErrorCode.VALIDATION_ERROR, "Validation failed",
                HttpStatus.BAD_REQUEST, request, traceId)
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Unreadable bodies. Field errors raised while Jackson builds a record
     * arrive wrapped here and are reported with their own code and message.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof ValidationException validation) {
            return handleValidation(validation, request);
        }

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());

        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST, "Invalid request body",
                HttpStatus.BAD_REQUEST, request, traceId)
            .detail(cause.getMessage())
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());

        ErrorResponse response = baseResponse(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST, request, traceId)
            .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());

        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED, request, traceId)
            .build();

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        // FATAL: Unexpected errors are always fatal
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);

        ErrorResponse response = baseResponse(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Helpers ====================

    private ErrorResponse.ErrorResponseBuilder baseResponse(ErrorCode errorCode, String message,
            HttpStatus status, HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    // the correlation id set by the request filter doubles as the trace id
    private String getOrCreateTraceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }

    private void logError(ChaosLabException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, EXPERIMENT_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case STATE_TRANSITION_INVALID ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, INVALID_FIELD_VALUE,
                    FAULT_CONFIGURATION_INVALID, DEFINITION_LOAD_FAILED ->
                HttpStatus.BAD_REQUEST;
            case UNEXPECTED_ERROR ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
