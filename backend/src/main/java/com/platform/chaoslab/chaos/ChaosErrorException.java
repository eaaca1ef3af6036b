package com.platform.chaoslab.chaos;

/**
 * Simulated application error with a numeric code.
 * Rendered as {@code [code] message}.
 */
public class ChaosErrorException extends InjectedFaultException {
    
    private final int errorCode;
    private final String errorMessage;
    
    public ChaosErrorException(int errorCode, String errorMessage) {
        super(FaultType.ERROR, FailureCategory.APPLICATION_ERROR, 
            String.format("[%d] %s", errorCode, errorMessage));
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }
    
    public int getErrorCode() {
        return errorCode;
    }
    
    public String getErrorMessage() {
        return errorMessage;
    }
    
    @Override
    public String toString() {
        return getMessage();
    }
}
