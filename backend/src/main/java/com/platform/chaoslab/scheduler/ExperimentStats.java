package com.platform.chaoslab.scheduler;

/**
 * Counts of registered experiments by status.
 */
public record ExperimentStats(
    long total,
    long pending,
    long running,
    long completed,
    long aborted
) {
}
