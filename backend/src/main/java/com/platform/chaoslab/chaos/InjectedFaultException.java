package com.platform.chaoslab.chaos;

/**
 * Base type for every failure produced by firing a fault.
 * 
 * These are the intended product of injection and are never retried
 * internally; retry policy belongs to the code under test.
 */
public abstract class InjectedFaultException extends RuntimeException {
    
    private final FaultType faultType;
    private final FailureCategory category;
    
    protected InjectedFaultException(FaultType faultType, FailureCategory category, String message) {
        super(message);
        this.faultType = faultType;
        this.category = category;
    }
    
    public FaultType getFaultType() {
        return faultType;
    }
    
    public FailureCategory getCategory() {
        return category;
    }
    
    /**
     * Checks whether this fault falls under the given (possibly broader) category.
     */
    public boolean isA(FailureCategory broader) {
        return category.isA(broader);
    }
}
