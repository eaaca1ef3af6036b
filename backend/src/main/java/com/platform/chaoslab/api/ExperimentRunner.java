package com.platform.chaoslab.api;

import com.platform.chaoslab.config.ChaosConfig;
import com.platform.chaoslab.error.ChaosLabException;
import com.platform.chaoslab.error.InvalidExperimentStateException;
import com.platform.chaoslab.scheduler.ExperimentInfo;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Starts experiment runs on the runner pool so HTTP callers need not block
 * for the whole run.
 */
@Slf4j
@Service
public class ExperimentRunner {

    private final ExperimentScheduler scheduler;
    private final TaskExecutor executor;

    public ExperimentRunner(ExperimentScheduler scheduler,
            @Qualifier(ChaosConfig.RUNNER_EXECUTOR) TaskExecutor executor) {
        this.scheduler = scheduler;
        this.executor = executor;
    }

    /**
     * Submits a run of a PENDING experiment and returns its current view.
     *
     * Unknown ids and ids that are not PENDING are rejected before anything is
     * submitted. The scheduler repeats the check when the run starts, so a
     * concurrent start of the same id still fails fast on the pool thread.
     */
    public ExperimentInfo submit(String experimentId) {
        ExperimentStatus status = scheduler.getStatus(experimentId);
        if (status != ExperimentStatus.PENDING) {
            throw new InvalidExperimentStateException(experimentId, status, ExperimentStatus.RUNNING);
        }

        executor.execute(() -> {
            try {
                scheduler.run(experimentId);
            } catch (ChaosLabException e) {
                log.warn("Background run of experiment {} rejected: {}", experimentId, e.getMessage());
            }
        });

        log.info("Submitted experiment {} to the runner pool", experimentId);
        return scheduler.getExperiment(experimentId);
    }
}
