package com.platform.chaoslab.definition;

import com.platform.chaoslab.config.ChaosConfig;
import com.platform.chaoslab.config.ChaosLabProperties;
import com.platform.chaoslab.scheduler.ExperimentDefinition;
import com.platform.chaoslab.scheduler.ExperimentResult;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the experiment named by {@code chaoslab.startup.experiment-file} once
 * the application is ready, then logs a text report of the result.
 */
@Slf4j
@Component
public class StartupExperimentRunner {

    private final ChaosLabProperties properties;
    private final ExperimentDefinitionLoader loader;
    private final ExperimentScheduler scheduler;
    private final TaskExecutor executor;

    public StartupExperimentRunner(ChaosLabProperties properties, ExperimentDefinitionLoader loader,
            ExperimentScheduler scheduler, @Qualifier(ChaosConfig.RUNNER_EXECUTOR) TaskExecutor executor) {
        this.properties = properties;
        this.loader = loader;
        this.scheduler = scheduler;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String file = properties.getStartup().getExperimentFile();
        if (file == null || file.isBlank()) {
            return;
        }

        ExperimentDefinition definition = loader.load(Path.of(file));
        String experimentId = scheduler.schedule(definition);
        log.info("Running startup experiment '{}' (id={}) for {}s",
            definition.name(), experimentId, definition.durationSeconds());

        executor.execute(() -> runAndReport(experimentId));
    }

    String runAndReport(String experimentId) {
        ExperimentResult result = scheduler.run(experimentId);
        String report = ExperimentReportFormatter.format(result);
        log.info("Startup experiment finished\n{}", report);
        return report;
    }
}
