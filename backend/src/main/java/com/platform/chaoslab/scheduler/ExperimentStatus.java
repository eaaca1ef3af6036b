package com.platform.chaoslab.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a chaos experiment.
 * 
 * PENDING -> RUNNING -> COMPLETED | ABORTED. Terminal states have no exits;
 * scheduling the id again starts a fresh PENDING lifecycle.
 */
public enum ExperimentStatus {
    /**
     * Registered, not yet run.
     */
    PENDING,
    
    /**
     * Tick loop in progress.
     */
    RUNNING,
    
    /**
     * Loop reached its deadline without an abort signal.
     */
    COMPLETED,
    
    /**
     * Abort signal observed at a tick boundary.
     */
    ABORTED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
    
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
