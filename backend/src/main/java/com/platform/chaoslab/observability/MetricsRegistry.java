package com.platform.chaoslab.observability;

import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for chaos metrics.
 * Records fired and raised faults per type and experiment lifecycle events.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    static final String FAULTS_FIRED = "chaoslab.faults.fired";
    static final String FAULTS_RAISED = "chaoslab.faults.raised";
    static final String EXPERIMENTS_STARTED = "chaoslab.experiments.started";
    static final String EXPERIMENTS_FINISHED = "chaoslab.experiments.finished";
    static final String EXPERIMENT_DURATION = "chaoslab.experiments.duration";
    static final String ONE_OFF_INJECTIONS = "chaoslab.injections.oneoff";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Timer experimentDuration;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.experimentDuration = Timer.builder(EXPERIMENT_DURATION)
            .description("Wall-clock duration of experiment runs")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record a fault whose probability gate fired.
     */
    public void recordFaultFired(FaultType type) {
        counter(FAULTS_FIRED, "type", type.getValue()).increment();
    }
    
    /**
     * Record a fired fault that raised an exception.
     */
    public void recordFaultRaised(FaultType type) {
        counter(FAULTS_RAISED, "type", type.getValue()).increment();
    }
    
    /**
     * Record a one-off injection requested through the API.
     */
    public void recordOneOffInjection(FaultType type, boolean raised) {
        counter(ONE_OFF_INJECTIONS, "type", type.getValue(), "raised", String.valueOf(raised)).increment();
    }
    
    public void recordExperimentStarted() {
        counter(EXPERIMENTS_STARTED).increment();
    }
    
    /**
     * Record a finished run and its duration.
     */
    public void recordExperimentFinished(ExperimentStatus status, Duration duration) {
        counter(EXPERIMENTS_FINISHED, "status", status.getValue()).increment();
        experimentDuration.record(duration);
        log.debug("Recorded experiment finished: {} after {}", status, duration);
    }
    
    /**
     * Current value of a counter, or 0 if it was never incremented.
     */
    public double count(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0.0;
    }
    
    private Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
    
    private static String key(String name, String... tags) {
        return name + "." + String.join(".", tags);
    }
}
