package com.platform.chaoslab.config;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.observability.MetricsRegistry;
import com.platform.chaoslab.observability.StructuredLogger;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configuration for chaos engineering components.
 */
@Slf4j
@Configuration
public class ChaosConfig {

    public static final String RUNNER_EXECUTOR = "experimentRunnerExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FaultInjector faultInjector(ChaosLabProperties properties) {
        Long seed = properties.getInjector().getSeed();
        if (seed != null) {
            log.info("Fault injector seeded with {}", seed);
            return FaultInjector.seeded(seed);
        }
        return new FaultInjector();
    }

    @Bean
    public ExperimentScheduler experimentScheduler(FaultInjector faultInjector,
            MetricsRegistry metricsRegistry, StructuredLogger structuredLogger, Clock clock) {
        return new ExperimentScheduler(faultInjector, metricsRegistry, structuredLogger, clock);
    }

    /**
     * Pool that runs experiments started without waiting for the result.
     */
    @Bean(name = RUNNER_EXECUTOR)
    public ThreadPoolTaskExecutor experimentRunnerExecutor(ChaosLabProperties properties) {
        int poolSize = properties.getRunner().getPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("experiment-runner-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
