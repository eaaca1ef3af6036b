package com.platform.chaoslab.observability;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    CHAOS_EXPERIMENT_SCHEDULED,
    CHAOS_EXPERIMENT_STARTED,
    CHAOS_EXPERIMENT_FINISHED,
    CHAOS_EXPERIMENT_ABORT_REQUESTED,
    CHAOS_INJECTION_PERFORMED
}
