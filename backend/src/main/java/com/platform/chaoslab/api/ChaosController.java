package com.platform.chaoslab.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultSpec;
import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.chaos.InjectedFaultException;
import com.platform.chaoslab.error.ResourceNotFoundException;
import com.platform.chaoslab.observability.MetricsRegistry;
import com.platform.chaoslab.observability.StructuredLogger;
import com.platform.chaoslab.scheduler.ExperimentDefinition;
import com.platform.chaoslab.scheduler.ExperimentInfo;
import com.platform.chaoslab.scheduler.ExperimentResult;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import com.platform.chaoslab.scheduler.ExperimentStats;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * REST API for one-off injection and chaos experiments.
 */
@Slf4j
@RestController
@RequestMapping("/api/chaos")
@RequiredArgsConstructor
public class ChaosController {

    private final FaultInjector faultInjector;
    private final ExperimentScheduler scheduler;
    private final ExperimentRunner experimentRunner;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    /**
     * Inject one fault immediately with probability 1.0.
     * A raised fault is reported in the body, not as an HTTP error.
     */
    @PostMapping("/inject")
    public InjectResponse inject(@Valid @RequestBody InjectRequest request) {
        FaultSpec spec = FaultSpec.builder()
            .faultType(request.getFaultType())
            .probability(1.0)
            .durationMs(request.getDurationMs())
            .errorCode(request.getErrorCode())
            .errorMessage(request.getMessage())
            .affectedTargets(List.of(request.getTarget()))
            .build();

        log.info("Injecting '{}' fault into target '{}'", spec.faultType(), request.getTarget());

        long start = System.nanoTime();
        String exceptionType = null;
        String message;
        try {
            faultInjector.inject(spec);
            message = "Fault injection complete, no exception raised";
        } catch (InjectedFaultException e) {
            exceptionType = e.getClass().getSimpleName();
            message = e.getMessage();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        boolean raised = exceptionType != null;

        metricsRegistry.recordOneOffInjection(spec.faultType(), raised);
        structuredLogger.injectionPerformed(spec.faultType(), request.getTarget(), raised, message, elapsedMs);

        return new InjectResponse(spec.faultType(), request.getTarget(), raised, exceptionType, message, elapsedMs);
    }

    @PostMapping("/experiments")
    public ResponseEntity<ScheduleResponse> scheduleExperiment(@RequestBody ExperimentDefinition definition) {
        String experimentId = scheduler.schedule(definition);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new ScheduleResponse(experimentId, scheduler.getStatus(experimentId)));
    }

    /**
     * Start a run. By default the run goes to the runner pool and this returns
     * 202 at once; with {@code wait=true} the run happens on the request thread
     * and the full result is returned.
     */
    @PostMapping("/experiments/{id}/run")
    public ResponseEntity<?> runExperiment(
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean wait) {

        if (wait) {
            return ResponseEntity.ok(scheduler.run(id));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(experimentRunner.submit(id));
    }

    @PostMapping("/experiments/{id}/abort")
    public ExperimentInfo abortExperiment(@PathVariable String id) {
        scheduler.abort(id);
        return scheduler.getExperiment(id);
    }

    @GetMapping("/experiments")
    public List<ExperimentInfo> getAllExperiments() {
        return scheduler.listExperiments();
    }

    @GetMapping("/experiments/{id}")
    public ExperimentInfo getExperiment(@PathVariable String id) {
        return scheduler.getExperiment(id);
    }

    /**
     * Latest result of an experiment. While a run is in flight this is the
     * RUNNING placeholder.
     */
    @GetMapping("/experiments/{id}/result")
    public ExperimentResult getResult(@PathVariable String id) {
        return scheduler.getResult(id)
            .orElseThrow(() -> new ResourceNotFoundException("Experiment result", id));
    }

    @GetMapping("/stats")
    public ExperimentStats getStats() {
        return scheduler.getStats();
    }

    @GetMapping("/fault-types")
    public FaultType[] getFaultTypes() {
        return FaultType.values();
    }

    // DTOs

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InjectRequest {
        @NotNull
        @JsonProperty("fault_type")
        private FaultType faultType;

        @Min(0)
        @JsonProperty("duration_ms")
        private Long durationMs = 500L;

        @JsonProperty("error_code")
        private Integer errorCode = 500;

        private String message = "Injected fault";

        @NotBlank
        private String target = "*";
    }

    public record InjectResponse(
        @JsonProperty("fault_type") FaultType faultType,
        @JsonProperty("target") String target,
        @JsonProperty("raised") boolean raised,
        @JsonProperty("exception_type") String exceptionType,
        @JsonProperty("message") String message,
        @JsonProperty("elapsed_ms") long elapsedMs
    ) {
    }

    public record ScheduleResponse(
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("status") ExperimentStatus status
    ) {
    }
}
