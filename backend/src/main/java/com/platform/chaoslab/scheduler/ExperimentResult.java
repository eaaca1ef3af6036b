package com.platform.chaoslab.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.chaoslab.observation.Observation;

import java.time.Instant;
import java.util.List;

/**
 * Complete record of one experiment run.
 * While a run is in flight the scheduler holds a RUNNING result with no end
 * time, no observations and an empty summary.
 */
public record ExperimentResult(
    @JsonProperty("experiment") ExperimentDefinition definition,
    @JsonProperty("status") ExperimentStatus status,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("observations") List<Observation> observations,
    @JsonProperty("summary") ExperimentSummary summary
) {
    
    public ExperimentResult {
        observations = observations == null ? List.of() : List.copyOf(observations);
        summary = summary == null ? ExperimentSummary.empty() : summary;
    }
    
    static ExperimentResult running(ExperimentDefinition definition, Instant startTime) {
        return new ExperimentResult(definition, ExperimentStatus.RUNNING, startTime, 
            null, List.of(), ExperimentSummary.empty());
    }
    
    public String experimentId() {
        return definition.experimentId();
    }
}
