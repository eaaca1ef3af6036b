package com.platform.chaoslab.error;

/**
 * Base exception for all service-side failures.
 * Carries an ErrorCode for standardized error handling.
 * 
 * Simulated faults raised by the injector are deliberately not part of this
 * hierarchy; see {@link com.platform.chaoslab.chaos.InjectedFaultException}.
 */
public abstract class ChaosLabException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ChaosLabException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ChaosLabException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ChaosLabException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
