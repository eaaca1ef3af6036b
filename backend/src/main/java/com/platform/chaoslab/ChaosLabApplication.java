package com.platform.chaoslab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Chaos Lab Application
 *
 * In-process fault injection service:
 * - One-off probabilistic fault injection
 * - Timed, abortable chaos experiments with per-run observation logs
 * - Method-level fault wrappers (@ChaosMonkey, @ResilienceTest)
 */
@SpringBootApplication
public class ChaosLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChaosLabApplication.class, args);
    }
}
