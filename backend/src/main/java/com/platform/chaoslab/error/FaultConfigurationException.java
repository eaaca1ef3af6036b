package com.platform.chaoslab.error;

import com.platform.chaoslab.chaos.FaultType;

/**
 * A fault specification was used with a type whose required field is missing,
 * e.g. a latency fault without a duration.
 * 
 * This signals caller misuse. It is never counted as an injected fault.
 */
public class FaultConfigurationException extends ChaosLabException {
    
    private final FaultType faultType;
    private final String field;
    
    public FaultConfigurationException(FaultType faultType, String field) {
        super(ErrorCode.FAULT_CONFIGURATION_INVALID,
            String.format("Fault type '%s' requires field '%s'", faultType, field));
        this.faultType = faultType;
        this.field = field;
    }
    
    public FaultType getFaultType() {
        return faultType;
    }
    
    public String getField() {
        return field;
    }
}
