package com.platform.chaoslab.scheduler;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultSpec;
import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.chaos.InjectedFaultException;
import com.platform.chaoslab.error.ExperimentNotFoundException;
import com.platform.chaoslab.error.InvalidExperimentStateException;
import com.platform.chaoslab.observability.LoggingConfig;
import com.platform.chaoslab.observability.MetricsRegistry;
import com.platform.chaoslab.observability.StructuredLogger;
import com.platform.chaoslab.observation.ExperimentObserver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registers, runs and aborts chaos experiments.
 *
 * {@link #run} executes the tick loop on the calling thread; running several
 * experiments at once means calling {@code run} from several threads. Each run
 * gets its own {@link ExperimentObserver} and each id its own abort flag, so
 * runs of different ids never share mutable state.
 *
 * Registry access is serialized on this instance. The abort flag is an
 * {@link AtomicBoolean} and may be set from any thread while a run is in
 * flight; it is checked once per tick, so abort latency is at most one tick.
 */
@Slf4j
public class ExperimentScheduler {

    public static final String SCHEDULER_TARGET = "scheduler";
    public static final String WILDCARD_TARGET = "*";

    private static final long TICK_NANOS = TimeUnit.SECONDS.toNanos(1);

    // Valid state transitions (from -> to)
    private static final Map<ExperimentStatus, Set<ExperimentStatus>> ALLOWED_TRANSITIONS = Map.of(
        ExperimentStatus.PENDING, Set.of(ExperimentStatus.RUNNING),
        ExperimentStatus.RUNNING, Set.of(ExperimentStatus.COMPLETED, ExperimentStatus.ABORTED),
        ExperimentStatus.COMPLETED, Set.of(),
        ExperimentStatus.ABORTED, Set.of()
    );

    private final FaultInjector injector;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    // guarded by this
    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    public ExperimentScheduler(FaultInjector injector, MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this(injector, metricsRegistry, structuredLogger, Clock.systemUTC());
    }

    public ExperimentScheduler(FaultInjector injector, MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger, Clock clock) {
        this.injector = injector;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Registers {@code definition} in PENDING state and returns its id.
     *
     * A caller-supplied id is used verbatim; an empty one is replaced by a
     * random UUID. Scheduling an id again replaces its definition and clears
     * its abort flag and latest result.
     *
     * @throws InvalidExperimentStateException if the id is currently running
     */
    public String schedule(ExperimentDefinition definition) {
        String experimentId = definition.hasExperimentId()
            ? definition.experimentId()
            : UUID.randomUUID().toString();
        ExperimentDefinition stored = definition.withExperimentId(experimentId);

        synchronized (this) {
            Registration existing = registrations.get(experimentId);
            if (existing != null && existing.status == ExperimentStatus.RUNNING) {
                throw new InvalidExperimentStateException(experimentId,
                    ExperimentStatus.RUNNING, ExperimentStatus.PENDING);
            }
            registrations.put(experimentId, new Registration(stored));
        }

        log.info("Scheduled experiment '{}' (id={}, duration={}s, faults={})",
            stored.name(), experimentId, stored.durationSeconds(), stored.faultSpecs().size());
        structuredLogger.experimentScheduled(experimentId, stored.name(),
            stored.durationSeconds(), stored.faultSpecs().size());
        return experimentId;
    }

    /**
     * Runs the experiment synchronously until its duration elapses or an
     * abort is observed.
     *
     * Injected faults are caught per tick and turned into observations and
     * counters; they never escape this method.
     *
     * @throws ExperimentNotFoundException if the id was never scheduled
     * @throws InvalidExperimentStateException if the id is running or has already finished
     * @throws com.platform.chaoslab.error.FaultConfigurationException if a fault spec lacks a required field
     */
    public ExperimentResult run(String experimentId) {
        Registration registration;
        Instant startTime;

        synchronized (this) {
            registration = requireRegistration(experimentId);
            for (FaultSpec spec : registration.definition.faultSpecs()) {
                injector.validate(spec);
            }
            transition(registration, ExperimentStatus.RUNNING);
            startTime = clock.instant();
            registration.latestResult = ExperimentResult.running(registration.definition, startTime);
        }

        LoggingConfig.setExperimentContext(experimentId);
        try {
            log.info("Running experiment '{}' (id={}) for {}s",
                registration.definition.name(), experimentId, registration.definition.durationSeconds());
            metricsRegistry.recordExperimentStarted();
            structuredLogger.experimentStarted(experimentId, registration.definition.name());

            return execute(registration, startTime);
        } catch (RuntimeException e) {
            abandon(registration, startTime, e);
            throw e;
        } finally {
            LoggingConfig.clearExperimentContext();
        }
    }

    /**
     * Sets the abort flag for {@code experimentId}. Idempotent; a flag set
     * before {@link #run} starts aborts the run at its first tick.
     *
     * @throws ExperimentNotFoundException if the id was never scheduled
     */
    public void abort(String experimentId) {
        boolean newlyRequested;
        synchronized (this) {
            newlyRequested = requireRegistration(experimentId).abortRequested.compareAndSet(false, true);
        }
        if (newlyRequested) {
            log.info("Abort requested for experiment {}", experimentId);
            structuredLogger.abortRequested(experimentId);
        }
    }

    /**
     * Latest result for {@code experimentId}, empty if it never started or is unknown.
     */
    public synchronized Optional<ExperimentResult> getResult(String experimentId) {
        Registration registration = registrations.get(experimentId);
        return registration == null ? Optional.empty() : Optional.ofNullable(registration.latestResult);
    }

    public synchronized ExperimentStatus getStatus(String experimentId) {
        return requireRegistration(experimentId).status;
    }

    public synchronized ExperimentDefinition getDefinition(String experimentId) {
        return requireRegistration(experimentId).definition;
    }

    public synchronized ExperimentInfo getExperiment(String experimentId) {
        return requireRegistration(experimentId).toInfo();
    }

    public synchronized List<ExperimentInfo> listExperiments() {
        List<ExperimentInfo> infos = new ArrayList<>(registrations.size());
        for (Registration registration : registrations.values()) {
            infos.add(registration.toInfo());
        }
        return infos;
    }

    public synchronized ExperimentStats getStats() {
        Map<ExperimentStatus, Long> byStatus = new EnumMap<>(ExperimentStatus.class);
        for (Registration registration : registrations.values()) {
            byStatus.merge(registration.status, 1L, Long::sum);
        }
        return new ExperimentStats(
            registrations.size(),
            byStatus.getOrDefault(ExperimentStatus.PENDING, 0L),
            byStatus.getOrDefault(ExperimentStatus.RUNNING, 0L),
            byStatus.getOrDefault(ExperimentStatus.COMPLETED, 0L),
            byStatus.getOrDefault(ExperimentStatus.ABORTED, 0L)
        );
    }

    // ==================== Tick loop ====================

    private ExperimentResult execute(Registration registration, Instant startTime) {
        ExperimentDefinition definition = registration.definition;
        ExperimentObserver observer = new ExperimentObserver(clock);
        Map<FaultType, Integer> faultsByType = new EnumMap<>(FaultType.class);
        Map<FaultType, Integer> errorsByType = new EnumMap<>(FaultType.class);

        observer.record(SCHEDULER_TARGET, "experiment_started", Map.of(
            "experiment_id", definition.experimentId(),
            "name", definition.name()));

        long startNanos = System.nanoTime();
        long deadlineNanos = TimeUnit.SECONDS.toNanos(definition.durationSeconds());
        boolean aborted = false;
        int ticks = 0;

        while (System.nanoTime() - startNanos < deadlineNanos) {
            if (registration.abortRequested.get()) {
                aborted = true;
                break;
            }

            tick(definition, observer, faultsByType, errorsByType);
            ticks++;

            long elapsed = System.nanoTime() - startNanos;
            long nextBoundary = Math.min((elapsed / TICK_NANOS + 1) * TICK_NANOS, deadlineNanos);
            if (!sleepUntil(startNanos + nextBoundary)) {
                log.warn("Experiment {} interrupted, stopping as aborted", definition.experimentId());
                aborted = true;
                break;
            }
        }

        // an abort that lands after the last tick check still counts
        aborted = aborted || registration.abortRequested.get();

        Instant endTime = clock.instant();
        long elapsedNanos = System.nanoTime() - startNanos;
        ExperimentStatus finalStatus = aborted ? ExperimentStatus.ABORTED : ExperimentStatus.COMPLETED;

        observer.record(SCHEDULER_TARGET, "experiment_ended", Map.of(
            "status", finalStatus.getValue(),
            "ticks", ticks));

        ExperimentSummary summary = ExperimentSummary.of(faultsByType, errorsByType, elapsedNanos / 1e9);
        ExperimentResult result = new ExperimentResult(definition, finalStatus, startTime, endTime,
            observer.snapshot(), summary);

        synchronized (this) {
            transition(registration, finalStatus);
            registration.latestResult = result;
        }

        metricsRegistry.recordExperimentFinished(finalStatus, Duration.ofNanos(elapsedNanos));
        structuredLogger.experimentFinished(definition.experimentId(), finalStatus, summary);
        log.info("Experiment {} finished with status {} after {} ticks (faults fired: {})",
            definition.experimentId(), finalStatus, ticks, summary.totalFaultsFired());

        return result;
    }

    /**
     * Applies every fault spec once to each of its targets.
     */
    private void tick(ExperimentDefinition definition, ExperimentObserver observer,
            Map<FaultType, Integer> faultsByType, Map<FaultType, Integer> errorsByType) {

        for (FaultSpec spec : definition.faultSpecs()) {
            FaultType type = spec.faultType();
            for (String target : targetsFor(definition, spec)) {
                try {
                    if (injector.inject(spec)) {
                        faultsByType.merge(type, 1, Integer::sum);
                        metricsRegistry.recordFaultFired(type);
                        observer.record(target, type.getValue() + "_injected", Map.of(
                            "probability", spec.probability()));
                    }
                } catch (InjectedFaultException e) {
                    faultsByType.merge(type, 1, Integer::sum);
                    errorsByType.merge(type, 1, Integer::sum);
                    metricsRegistry.recordFaultFired(type);
                    metricsRegistry.recordFaultRaised(type);
                    observer.record(target, type.getValue() + "_exception", Map.of(
                        "fault_type", type.getValue(),
                        "exception", e.getMessage()));
                }
            }
        }
    }

    static List<String> targetsFor(ExperimentDefinition definition, FaultSpec spec) {
        if (!spec.affectedTargets().isEmpty()) {
            return spec.affectedTargets();
        }
        if (!definition.defaultTargets().isEmpty()) {
            return definition.defaultTargets();
        }
        return List.of(WILDCARD_TARGET);
    }

    /**
     * Sleeps until {@code System.nanoTime()} reaches {@code deadline}.
     *
     * @return false if the thread was interrupted
     */
    private static boolean sleepUntil(long deadline) {
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    // ==================== State ====================

    private Registration requireRegistration(String experimentId) {
        Registration registration = registrations.get(experimentId);
        if (registration == null) {
            throw new ExperimentNotFoundException(experimentId);
        }
        return registration;
    }

    private void transition(Registration registration, ExperimentStatus target) {
        ExperimentStatus current = registration.status;
        if (!ALLOWED_TRANSITIONS.get(current).contains(target)) {
            log.warn("Invalid state transition rejected: {} -> {} for experiment {}",
                current, target, registration.definition.experimentId());
            throw new InvalidExperimentStateException(registration.definition.experimentId(), current, target);
        }
        registration.status = target;
        log.debug("State transition: {} -> {} for experiment {}",
            current, target, registration.definition.experimentId());
    }

    /**
     * Moves a run that failed unexpectedly to ABORTED so the id is not left RUNNING.
     */
    private void abandon(Registration registration, Instant startTime, RuntimeException cause) {
        log.error("Experiment {} failed unexpectedly: {}",
            registration.definition.experimentId(), cause.getMessage(), cause);
        synchronized (this) {
            if (registration.status == ExperimentStatus.RUNNING) {
                registration.status = ExperimentStatus.ABORTED;
                registration.latestResult = new ExperimentResult(registration.definition,
                    ExperimentStatus.ABORTED, startTime, clock.instant(), List.of(), ExperimentSummary.empty());
            }
        }
    }

    private static final class Registration {
        private final ExperimentDefinition definition;
        private final AtomicBoolean abortRequested = new AtomicBoolean(false);
        private volatile ExperimentStatus status = ExperimentStatus.PENDING;
        private volatile ExperimentResult latestResult;

        private Registration(ExperimentDefinition definition) {
            this.definition = definition;
        }

        private ExperimentInfo toInfo() {
            return new ExperimentInfo(definition.experimentId(), definition.name(), status,
                abortRequested.get(), definition);
        }
    }
}
