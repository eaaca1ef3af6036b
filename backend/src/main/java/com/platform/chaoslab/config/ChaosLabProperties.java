package com.platform.chaoslab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the chaos lab service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "chaoslab")
public class ChaosLabProperties {

    /**
     * Service name stamped on structured log events.
     */
    private String serviceName = "chaos-lab";

    /**
     * Deployment environment stamped on structured log events.
     */
    private String environment = "development";

    private Injector injector = new Injector();

    private Runner runner = new Runner();

    private Startup startup = new Startup();

    @Data
    public static class Injector {
        /**
         * Seed for the injector's random source. Unset means a fresh,
         * non-reproducible source.
         */
        private Long seed;
    }

    @Data
    public static class Runner {
        /**
         * Threads available for experiments started asynchronously over HTTP.
         */
        private int poolSize = 4;
    }

    @Data
    public static class Startup {
        /**
         * Definition file (YAML or JSON) to schedule and run at startup.
         */
        private String experimentFile;
    }
}
