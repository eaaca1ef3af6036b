package com.platform.chaoslab.chaos;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.chaoslab.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Types of faults that can be injected into a unit of work.
 * 
 * Each fault type is applied in-process by {@link FaultInjector}; nothing here
 * touches real network, disk or process resources.
 */
public enum FaultType {
    /**
     * Block the calling thread for a configured number of milliseconds.
     * Requires: durationMs.
     */
    LATENCY("latency"),
    
    /**
     * Raise an application error carrying a code and message.
     * Requires: errorCode.
     */
    ERROR("error"),
    
    /**
     * Raise a simulated timeout.
     */
    TIMEOUT("timeout"),
    
    /**
     * Raise a generic runtime failure tagged as partial.
     */
    PARTIAL_FAILURE("partial_failure"),
    
    /**
     * Raise a simulated resource exhaustion.
     */
    RESOURCE_EXHAUSTION("resource_exhaustion"),
    
    /**
     * Raise a simulated data validation failure.
     */
    DATA_CORRUPTION("data_corruption");
    
    private final String value;
    
    FaultType(String value) {
        this.value = value;
    }
    
    /**
     * Wire name used in definitions, observations and summaries.
     */
    @JsonKey
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Checks if firing this fault raises an exception rather than only blocking.
     */
    public boolean raisesFailure() {
        return this != LATENCY;
    }
    
    /**
     * Parses a wire name, case-insensitively. Enum constant names are accepted too.
     */
    @JsonCreator
    public static FaultType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("fault_type", "must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FaultType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("fault_type", raw, "expected one of " + 
            Arrays.stream(values()).map(FaultType::getValue).collect(Collectors.joining(", ")));
    }
    
    @Override
    public String toString() {
        return value;
    }
}
