package com.platform.chaoslab.chaos;

import com.platform.chaoslab.error.FaultConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Random;

/**
 * Probabilistic fault dispatcher.
 * 
 * Given a {@link FaultSpec}, decides once whether to fire and, if so, applies
 * exactly one effect: block the caller (latency) or throw a typed
 * {@link InjectedFaultException}. Fired faults always propagate to the
 * immediate caller.
 * 
 * The random source is injectable so that a seeded instance reproduces the
 * same firing sequence. {@link Random} is thread-safe, so one injector can be
 * shared across threads.
 */
@Slf4j
public class FaultInjector {
    
    static final String DEFAULT_ERROR_MESSAGE = "Injected error";
    static final String DEFAULT_PARTIAL_FAILURE_MESSAGE = "Partial failure";
    static final String DEFAULT_RESOURCE_EXHAUSTION_MESSAGE = "Resource exhausted";
    static final String DEFAULT_DATA_CORRUPTION_MESSAGE = "Data corrupted";
    static final String TIMEOUT_MESSAGE = "Simulated timeout injected by chaos framework.";
    
    private final Random random;
    
    public FaultInjector() {
        this(new Random());
    }
    
    public FaultInjector(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }
    
    /**
     * Creates an injector whose firing sequence is reproducible for a given seed.
     */
    public static FaultInjector seeded(long seed) {
        return new FaultInjector(new Random(seed));
    }
    
    /**
     * Returns true with the given probability.
     * The extremes 0 and 1 never consume a sample.
     */
    public boolean shouldFire(double probability) {
        if (probability <= 0.0) {
            return false;
        }
        if (probability >= 1.0) {
            return true;
        }
        return random.nextDouble() < probability;
    }
    
    /**
     * Blocks the current thread for {@code durationMs} milliseconds.
     */
    public void fireLatency(long durationMs) {
        if (durationMs <= 0) {
            return;
        }
        try {
            Thread.sleep(durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Injected latency of {}ms interrupted", durationMs);
        }
    }
    
    public void fireError(int errorCode, String message) {
        throw new ChaosErrorException(errorCode, message);
    }
    
    public void fireTimeout() {
        throw new ChaosTimeoutException(TIMEOUT_MESSAGE);
    }
    
    public void firePartialFailure() {
        firePartialFailure(DEFAULT_PARTIAL_FAILURE_MESSAGE);
    }
    
    public void firePartialFailure(String message) {
        throw new PartialFailureException(message);
    }
    
    public void fireResourceExhaustion() {
        fireResourceExhaustion(DEFAULT_RESOURCE_EXHAUSTION_MESSAGE);
    }
    
    public void fireResourceExhaustion(String message) {
        throw new ResourceExhaustedException(message);
    }
    
    public void fireDataCorruption() {
        fireDataCorruption(DEFAULT_DATA_CORRUPTION_MESSAGE);
    }
    
    public void fireDataCorruption(String message) {
        throw new DataCorruptionException(message);
    }
    
    /**
     * Checks that {@code spec} carries the field its type requires.
     *
     * @throws FaultConfigurationException if the required field is missing
     */
    public void validate(FaultSpec spec) {
        switch (spec.faultType()) {
            case LATENCY -> {
                if (spec.durationMs() == null) {
                    throw new FaultConfigurationException(FaultType.LATENCY, "duration_ms");
                }
            }
            case ERROR -> {
                if (spec.errorCode() == null) {
                    throw new FaultConfigurationException(FaultType.ERROR, "error_code");
                }
            }
            case TIMEOUT, PARTIAL_FAILURE, RESOURCE_EXHAUSTION, DATA_CORRUPTION -> {
                // no required fields
            }
        }
    }
    
    /**
     * Applies {@code spec} once.
     * 
     * The spec is validated first, so a misconfigured spec fails regardless of
     * its probability. The probability gate is then evaluated exactly once.
     *
     * @return true if a non-raising fault (latency) fired, false if the gate did not fire
     * @throws FaultConfigurationException if the spec lacks a field its type requires
     * @throws InjectedFaultException if a raising fault fired
     */
    public boolean inject(FaultSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        validate(spec);
        
        if (!shouldFire(spec.probability())) {
            return false;
        }
        
        log.debug("Firing {} fault (probability={})", spec.faultType(), spec.probability());
        
        switch (spec.faultType()) {
            case LATENCY -> fireLatency(spec.durationMs());
            case ERROR -> fireError(spec.errorCode(), 
                messageOr(spec, DEFAULT_ERROR_MESSAGE));
            case TIMEOUT -> fireTimeout();
            case PARTIAL_FAILURE -> firePartialFailure(
                messageOr(spec, DEFAULT_PARTIAL_FAILURE_MESSAGE));
            case RESOURCE_EXHAUSTION -> fireResourceExhaustion(
                messageOr(spec, DEFAULT_RESOURCE_EXHAUSTION_MESSAGE));
            case DATA_CORRUPTION -> fireDataCorruption(
                messageOr(spec, DEFAULT_DATA_CORRUPTION_MESSAGE));
        }
        return true;
    }
    
    private static String messageOr(FaultSpec spec, String fallback) {
        String message = spec.errorMessage();
        return message == null || message.isEmpty() ? fallback : message;
    }
}
