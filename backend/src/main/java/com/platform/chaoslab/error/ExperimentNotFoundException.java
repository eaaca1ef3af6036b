package com.platform.chaoslab.error;

/**
 * Raised when an experiment id was never scheduled.
 */
public class ExperimentNotFoundException extends ResourceNotFoundException {
    
    public ExperimentNotFoundException(String experimentId) {
        super(ErrorCode.EXPERIMENT_NOT_FOUND, "Experiment", experimentId);
    }
}
