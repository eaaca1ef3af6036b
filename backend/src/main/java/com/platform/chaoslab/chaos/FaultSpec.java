package com.platform.chaoslab.chaos;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.chaoslab.error.ValidationException;
import lombok.Builder;

import java.util.List;

/**
 * Declarative, immutable specification for a single injectable fault.
 * 
 * Only field ranges are checked here. Whether a type's required field is
 * present (latency needs a duration, error needs a code) is checked by
 * {@link FaultInjector} when the spec is used, so an incomplete spec can be
 * built and passed around.
 *
 * @param faultType       the kind of fault to inject
 * @param probability     chance in [0, 1] that a single injection fires, defaults to 1.0
 * @param durationMs      blocking time for latency faults
 * @param errorCode       code carried by error faults
 * @param errorMessage    message for error, partial, resource and corruption faults
 * @param affectedTargets target labels this fault applies to, empty means the experiment defaults
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FaultSpec(
    @JsonProperty("fault_type") FaultType faultType,
    @JsonProperty("probability") Double probability,
    @JsonProperty("duration_ms") Long durationMs,
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("affected_targets") List<String> affectedTargets
) {
    
    public static final double DEFAULT_PROBABILITY = 1.0;
    
    public FaultSpec {
        if (faultType == null) {
            throw new ValidationException("fault_type", "is required");
        }
        if (probability == null) {
            probability = DEFAULT_PROBABILITY;
        }
        if (probability.isNaN() || probability < 0.0 || probability > 1.0) {
            throw new ValidationException("probability", probability, "must be between 0.0 and 1.0");
        }
        if (durationMs != null && durationMs < 0) {
            throw new ValidationException("duration_ms", durationMs, "must be non-negative");
        }
        affectedTargets = affectedTargets == null ? List.of() : List.copyOf(affectedTargets);
    }
}
