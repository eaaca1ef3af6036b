package com.platform.chaoslab.chaos;

/**
 * Generic runtime failure representing partial service degradation.
 */
public class PartialFailureException extends InjectedFaultException {
    
    public PartialFailureException(String message) {
        super(FaultType.PARTIAL_FAILURE, FailureCategory.PARTIAL_FAILURE, 
            "[" + FaultType.PARTIAL_FAILURE.getValue() + "] " + message);
    }
}
