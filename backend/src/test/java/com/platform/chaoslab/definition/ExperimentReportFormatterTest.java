package com.platform.chaoslab.definition;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.config.ChaosLabProperties;
import com.platform.chaoslab.observability.MetricsRegistry;
import com.platform.chaoslab.observability.StructuredLogger;
import com.platform.chaoslab.observation.Observation;
import com.platform.chaoslab.scheduler.ExperimentDefinition;
import com.platform.chaoslab.scheduler.ExperimentInfo;
import com.platform.chaoslab.scheduler.ExperimentResult;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import com.platform.chaoslab.scheduler.ExperimentSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExperimentReportFormatterTest {

    @Test
    void testFormatsFinishedRun() {
        ExperimentResult result = new ExperimentResult(
            ExperimentDefinition.builder().experimentId("rep-1").name("Report").build(),
            ExperimentStatus.COMPLETED,
            Instant.parse("2026-01-01T00:00:00Z"),
            Instant.parse("2026-01-01T00:00:02Z"),
            List.of(new Observation(Instant.parse("2026-01-01T00:00:00Z"), "t", "latency_injected", null)),
            ExperimentSummary.of(Map.of(FaultType.LATENCY, 2), Map.of(), 2.0));

        String report = ExperimentReportFormatter.format(result);

        assertThat(report.split("\n")).containsExactly(
            "Experiment: Report (id=rep-1)",
            "Status    : completed",
            "Start     : 2026-01-01T00:00:00Z",
            "End       : 2026-01-01T00:00:02Z",
            "Summary   :",
            "  total_faults_fired: 2",
            "  faults_by_type: {latency=2}",
            "  errors_by_type: {}",
            "  duration_seconds: 2.000",
            "Observations: 1 recorded");
    }

    @Test
    void testMissingEndTimeRendersNa() {
        ExperimentResult result = new ExperimentResult(
            ExperimentDefinition.builder().experimentId("rep-2").name("Running").build(),
            ExperimentStatus.RUNNING, Instant.parse("2026-01-01T00:00:00Z"), null, null, null);

        assertThat(ExperimentReportFormatter.format(result)).contains("End       : n/a");
    }

    @Test
    void testStartupRunnerLoadsRunsAndReports() throws Exception {
        ChaosLabProperties properties = new ChaosLabProperties();
        properties.getStartup().setExperimentFile(
            ExperimentDefinitionLoaderTest.fixture("latency.yaml").toString());
        ExperimentScheduler scheduler = new ExperimentScheduler(new FaultInjector(),
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger("chaos-lab", "test"));
        StartupExperimentRunner runner = new StartupExperimentRunner(properties,
            new ExperimentDefinitionLoader(), scheduler, new SyncTaskExecutor());

        runner.onApplicationReady();

        List<ExperimentInfo> experiments = scheduler.listExperiments();
        assertThat(experiments).extracting(ExperimentInfo::experimentId).containsExactly("yaml-latency");
        assertThat(experiments.get(0).status()).isEqualTo(ExperimentStatus.COMPLETED);
        assertThat(scheduler.getResult("yaml-latency")).hasValueSatisfying(
            r -> assertThat(r.summary().faultsFired(FaultType.LATENCY)).isEqualTo(1));
    }

    @Test
    void testStartupRunnerDoesNothingWithoutFile() {
        ExperimentScheduler scheduler = new ExperimentScheduler(new FaultInjector(),
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger("chaos-lab", "test"));
        StartupExperimentRunner runner = new StartupExperimentRunner(new ChaosLabProperties(),
            new ExperimentDefinitionLoader(), scheduler, new SyncTaskExecutor());

        runner.onApplicationReady();

        assertThat(scheduler.listExperiments()).isEmpty();
    }
}
