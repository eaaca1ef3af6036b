package com.platform.chaoslab.chaos;

/**
 * Simulated timeout. Its category is a narrowing of {@link FailureCategory#TIMEOUT}.
 */
public class ChaosTimeoutException extends InjectedFaultException {
    
    public ChaosTimeoutException(String message) {
        super(FaultType.TIMEOUT, FailureCategory.CHAOS_TIMEOUT, message);
    }
}
