package com.platform.chaoslab.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: application name in the Logback context and
 * correlation IDs on every request.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_EXPERIMENT_ID = "chaos_experiment_id";
    
    @Value("${spring.application.name:chaos-lab}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());
                
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }
    
    /**
     * Tag log lines on the current thread with an experiment id.
     */
    public static void setExperimentContext(String experimentId) {
        MDC.put(MDC_EXPERIMENT_ID, experimentId);
    }
    
    public static void clearExperimentContext() {
        MDC.remove(MDC_EXPERIMENT_ID);
    }
}
