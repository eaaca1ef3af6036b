package com.platform.chaoslab.error;

/**
 * Standardized error codes for the chaos lab service.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: CL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 5xx: Chaos domain errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("CL-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CL-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CL-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("CL-300", "Resource not found", ErrorCategory.RECOVERABLE),
    EXPERIMENT_NOT_FOUND("CL-302", "Chaos experiment not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Chaos Errors (5xx - Domain) ====================
    
    FAULT_CONFIGURATION_INVALID("CL-500", "Fault specification is incomplete for its type", ErrorCategory.RECOVERABLE),
    DEFINITION_LOAD_FAILED("CL-501", "Experiment definition could not be loaded", ErrorCategory.RECOVERABLE),
    STATE_TRANSITION_INVALID("CL-520", "Invalid experiment state transition", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("CL-901", "Unexpected error occurred", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
        
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - service is in bad state, may require intervention.
         */
        FATAL
    }
}
