package com.platform.chaoslab.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.chaoslab.chaos.FaultType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated counters for one experiment run.
 * 
 * {@code totalFaultsFired} is always the sum of {@code faultsByType}. A fault
 * counts as fired whenever its probability gate fired, whether or not it
 * raised; {@code errorsByType} counts only the ones that raised.
 */
public record ExperimentSummary(
    @JsonProperty("total_faults_fired") int totalFaultsFired,
    @JsonProperty("faults_by_type") Map<FaultType, Integer> faultsByType,
    @JsonProperty("errors_by_type") Map<FaultType, Integer> errorsByType,
    @JsonProperty("duration_seconds") double durationSeconds
) {
    
    public static ExperimentSummary empty() {
        return of(Map.of(), Map.of(), 0.0);
    }
    
    public static ExperimentSummary of(Map<FaultType, Integer> faultsByType, 
            Map<FaultType, Integer> errorsByType, double durationSeconds) {
        int total = faultsByType.values().stream().mapToInt(Integer::intValue).sum();
        return new ExperimentSummary(total, copy(faultsByType), copy(errorsByType), durationSeconds);
    }
    
    public int faultsFired(FaultType type) {
        return faultsByType.getOrDefault(type, 0);
    }
    
    public int errorsRaised(FaultType type) {
        return errorsByType.getOrDefault(type, 0);
    }
    
    private static Map<FaultType, Integer> copy(Map<FaultType, Integer> source) {
        if (source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
