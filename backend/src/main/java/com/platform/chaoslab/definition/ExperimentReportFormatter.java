package com.platform.chaoslab.definition;

import com.platform.chaoslab.scheduler.ExperimentResult;
import com.platform.chaoslab.scheduler.ExperimentSummary;

import java.time.Instant;
import java.util.Locale;

/**
 * Renders an {@link ExperimentResult} as a short plain-text report.
 */
public final class ExperimentReportFormatter {

    private ExperimentReportFormatter() {
    }

    public static String format(ExperimentResult result) {
        ExperimentSummary summary = result.summary();
        StringBuilder report = new StringBuilder();
        report.append("Experiment: ").append(result.definition().name())
            .append(" (id=").append(result.experimentId()).append(')').append('\n');
        report.append("Status    : ").append(result.status().getValue()).append('\n');
        report.append("Start     : ").append(isoOrNa(result.startTime())).append('\n');
        report.append("End       : ").append(isoOrNa(result.endTime())).append('\n');
        report.append("Summary   :").append('\n');
        report.append("  total_faults_fired: ").append(summary.totalFaultsFired()).append('\n');
        report.append("  faults_by_type: ").append(summary.faultsByType()).append('\n');
        report.append("  errors_by_type: ").append(summary.errorsByType()).append('\n');
        report.append("  duration_seconds: ").append(String.format(Locale.ROOT, "%.3f", summary.durationSeconds())).append('\n');
        report.append("Observations: ").append(result.observations().size()).append(" recorded");
        return report.toString();
    }

    private static String isoOrNa(Instant instant) {
        return instant == null ? "n/a" : instant.toString();
    }
}
