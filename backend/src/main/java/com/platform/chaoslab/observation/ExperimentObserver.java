package com.platform.chaoslab.observation;

import com.platform.chaoslab.chaos.InjectedFaultException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, append-only log of timestamped observations.
 * 
 * All mutations and snapshots are serialized through one lock, so
 * observations keep the order in which {@link #record} calls acquired it.
 * Each experiment run owns its own instance.
 */
public class ExperimentObserver {
    
    public static final String EXCEPTION_TYPE = "exception_type";
    public static final String MESSAGE = "message";
    public static final String CATEGORY = "category";
    
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Observation> observations = new ArrayList<>();
    private final Clock clock;
    
    public ExperimentObserver() {
        this(Clock.systemUTC());
    }
    
    public ExperimentObserver(Clock clock) {
        this.clock = clock;
    }
    
    public void record(String target, String event) {
        record(target, event, Map.of());
    }
    
    /**
     * Appends an observation stamped with the current UTC time.
     */
    public void record(String target, String event, Map<String, Object> details) {
        lock.lock();
        try {
            // timestamp taken under the lock so timestamps never go backwards in the log
            observations.add(new Observation(Instant.now(clock), target, event, details));
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Returns an independent copy of everything recorded so far.
     */
    public List<Observation> snapshot() {
        lock.lock();
        try {
            return List.copyOf(observations);
        } finally {
            lock.unlock();
        }
    }
    
    public int size() {
        lock.lock();
        try {
            return observations.size();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Discards all recorded observations.
     */
    public void clear() {
        lock.lock();
        try {
            observations.clear();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Runs {@code work} between a start and an end observation.
     * 
     * Events are {@code start}/{@code end}/{@code error} when the prefix is
     * empty, otherwise {@code <prefix>_start} and so on. When the work throws,
     * an error observation carrying the exception type and message is recorded
     * and the exception is rethrown unchanged.
     */
    public <T, E extends Exception> T scoped(String target, String eventPrefix, 
            ObservedWork<T, E> work) throws E {
        String prefix = eventPrefix == null || eventPrefix.isEmpty() ? "" : eventPrefix + "_";
        record(target, prefix + "start");
        T result;
        try {
            result = work.run();
        } catch (Exception e) {
            record(target, prefix + "error", errorDetails(e));
            throw e;
        }
        record(target, prefix + "end");
        return result;
    }
    
    public <T, E extends Exception> T scoped(String target, ObservedWork<T, E> work) throws E {
        return scoped(target, "", work);
    }
    
    /**
     * Void form of {@link #scoped(String, String, ObservedWork)}.
     */
    public <E extends Exception> void scopedRun(String target, String eventPrefix, 
            ObservedAction<E> action) throws E {
        scoped(target, eventPrefix, () -> {
            action.run();
            return null;
        });
    }
    
    private static Map<String, Object> errorDetails(Exception e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(EXCEPTION_TYPE, e.getClass().getSimpleName());
        details.put(MESSAGE, String.valueOf(e.getMessage()));
        if (e instanceof InjectedFaultException fault) {
            details.put(CATEGORY, fault.getCategory().name());
        }
        return details;
    }
}
