package com.platform.chaoslab.observability;

import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import com.platform.chaoslab.scheduler.ExperimentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured JSON logger for chaos events.
 * 
 * Events are written to the {@code structured.chaos} logger so they can be
 * routed separately from ordinary application logs.
 */
@Component
public class StructuredLogger {
    
    private static final Logger log = LoggerFactory.getLogger("structured.chaos");
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(
            @Value("${chaoslab.service-name:chaos-lab}") String serviceName,
            @Value("${chaoslab.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    public void experimentScheduled(String experimentId, String name, int durationSeconds, int faultCount) {
        StructuredLogEvent event = StructuredLogEvent.fromContext(serviceName, environment, 
                LogEventType.CHAOS_EXPERIMENT_SCHEDULED, "INFO")
            .chaosExperimentId(experimentId)
            .message("Experiment scheduled: " + name)
            .context(Map.of("duration_seconds", durationSeconds, "fault_specs", faultCount))
            .build();
        log.info(event.toJson());
    }
    
    public void experimentStarted(String experimentId, String name) {
        StructuredLogEvent event = StructuredLogEvent.fromContext(serviceName, environment, 
                LogEventType.CHAOS_EXPERIMENT_STARTED, "INFO")
            .chaosExperimentId(experimentId)
            .message("Experiment started: " + name)
            .status(ExperimentStatus.RUNNING.getValue())
            .build();
        log.info(event.toJson());
    }
    
    public void experimentFinished(String experimentId, ExperimentStatus status, ExperimentSummary summary) {
        StructuredLogEvent event = StructuredLogEvent.fromContext(serviceName, environment, 
                LogEventType.CHAOS_EXPERIMENT_FINISHED, "INFO")
            .chaosExperimentId(experimentId)
            .status(status.getValue())
            .success(status == ExperimentStatus.COMPLETED)
            .durationMs(Math.round(summary.durationSeconds() * 1000))
            .context(Map.of(
                "total_faults_fired", summary.totalFaultsFired(),
                "faults_by_type", summary.faultsByType(),
                "errors_by_type", summary.errorsByType()))
            .build();
        log.info(event.toJson());
    }
    
    public void abortRequested(String experimentId) {
        StructuredLogEvent event = StructuredLogEvent.fromContext(serviceName, environment, 
                LogEventType.CHAOS_EXPERIMENT_ABORT_REQUESTED, "WARN")
            .chaosExperimentId(experimentId)
            .build();
        log.warn(event.toJson());
    }
    
    public void injectionPerformed(FaultType faultType, String target, boolean raised, 
            String errorMessage, long durationMs) {
        StructuredLogEvent event = StructuredLogEvent.fromContext(serviceName, environment, 
                LogEventType.CHAOS_INJECTION_PERFORMED, "INFO")
            .faultType(faultType.getValue())
            .target(target)
            .success(true)
            .durationMs(durationMs)
            .errorMessage(raised ? errorMessage : null)
            .context(Map.of("raised", raised))
            .build();
        log.info(event.toJson());
    }
}
