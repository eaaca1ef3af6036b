package com.platform.chaoslab.chaos;

/**
 * Simulated resource exhaustion (pool drained, quota hit, out of memory).
 */
public class ResourceExhaustedException extends InjectedFaultException {
    
    public ResourceExhaustedException(String message) {
        super(FaultType.RESOURCE_EXHAUSTION, FailureCategory.RESOURCE_EXHAUSTION, 
            "[" + FaultType.RESOURCE_EXHAUSTION.getValue() + "] " + message);
    }
}
