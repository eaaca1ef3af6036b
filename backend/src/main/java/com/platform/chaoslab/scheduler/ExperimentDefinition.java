package com.platform.chaoslab.scheduler;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.chaoslab.chaos.FaultSpec;
import com.platform.chaoslab.error.ValidationException;
import lombok.Builder;

import java.util.List;

/**
 * A named bundle of fault specs run as a unit against a set of targets.
 *
 * @param experimentId    caller-supplied id, empty to have the scheduler generate one
 * @param name            human-readable name, defaults to empty
 * @param description     free text, defaults to empty
 * @param faultSpecs      faults applied on every tick, in order
 * @param durationSeconds run length in seconds, defaults to 60
 * @param defaultTargets  targets for specs that name none of their own
 */
@Builder(toBuilder = true)
public record ExperimentDefinition(
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("fault_specs") @JsonAlias("faults") List<FaultSpec> faultSpecs,
    @JsonProperty("duration_seconds") Integer durationSeconds,
    @JsonProperty("default_targets") @JsonAlias("target_components") List<String> defaultTargets
) {
    
    public static final int DEFAULT_DURATION_SECONDS = 60;
    
    public ExperimentDefinition {
        experimentId = experimentId == null ? "" : experimentId.trim();
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        if (durationSeconds == null) {
            durationSeconds = DEFAULT_DURATION_SECONDS;
        }
        if (durationSeconds <= 0) {
            throw new ValidationException("duration_seconds", durationSeconds, "must be greater than 0");
        }
        faultSpecs = faultSpecs == null ? List.of() : List.copyOf(faultSpecs);
        defaultTargets = defaultTargets == null ? List.of() : List.copyOf(defaultTargets);
    }
    
    public boolean hasExperimentId() {
        return !experimentId.isEmpty();
    }
    
    public ExperimentDefinition withExperimentId(String id) {
        return toBuilder().experimentId(id).build();
    }
}
