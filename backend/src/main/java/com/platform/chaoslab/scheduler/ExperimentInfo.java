package com.platform.chaoslab.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of a registered experiment.
 */
public record ExperimentInfo(
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("name") String name,
    @JsonProperty("status") ExperimentStatus status,
    @JsonProperty("abort_requested") boolean abortRequested,
    @JsonProperty("definition") ExperimentDefinition definition
) {
}
