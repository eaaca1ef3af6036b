package com.platform.chaoslab.error;

import com.platform.chaoslab.scheduler.ExperimentStatus;

/**
 * Raised when an experiment is asked to make a transition its current state
 * does not allow, such as running an id that is already running.
 */
public class InvalidExperimentStateException extends ChaosLabException {
    
    private final String experimentId;
    private final ExperimentStatus currentStatus;
    private final ExperimentStatus requestedStatus;
    
    public InvalidExperimentStateException(String experimentId, 
            ExperimentStatus currentStatus, ExperimentStatus requestedStatus) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
            String.format("Experiment %s cannot move from %s to %s", 
                experimentId, currentStatus, requestedStatus));
        this.experimentId = experimentId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
    
    public String getExperimentId() {
        return experimentId;
    }
    
    public ExperimentStatus getCurrentStatus() {
        return currentStatus;
    }
    
    public ExperimentStatus getRequestedStatus() {
        return requestedStatus;
    }
}
