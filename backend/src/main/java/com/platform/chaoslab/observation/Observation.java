package com.platform.chaoslab.observation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single timestamped event captured during an experiment.
 */
public record Observation(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("target") String target,
    @JsonProperty("event") String event,
    @JsonProperty("details") Map<String, Object> details
) {
    
    public Observation {
        details = details == null || details.isEmpty() 
            ? Map.of() 
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
