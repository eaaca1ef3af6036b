package com.platform.chaoslab.chaos;

/**
 * Simulated data validation failure. Its category is a narrowing of
 * {@link FailureCategory#INVALID_VALUE}.
 */
public class DataCorruptionException extends InjectedFaultException {
    
    public DataCorruptionException(String message) {
        super(FaultType.DATA_CORRUPTION, FailureCategory.DATA_CORRUPTION, 
            "[" + FaultType.DATA_CORRUPTION.getValue() + "] " + message);
    }
}
