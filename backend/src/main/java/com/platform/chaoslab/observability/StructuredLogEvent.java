package com.platform.chaoslab.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 * 
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - environment
 * - event_type
 * 
 * Optional contextual fields from MDC:
 * - correlation_id
 * - chaos_experiment_id
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    
    // Mandatory fields
    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    
    // Trace context (from MDC)
    private String correlationId;
    private String chaosExperimentId;
    
    // Event-specific data
    private String message;
    private String faultType;
    private String target;
    private String status;
    private Boolean success;
    private Long durationMs;
    private String errorMessage;
    
    // Additional context
    private Map<String, Object> context;
    
    /**
     * Convert to JSON string for logging.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            // Fallback to simple format
            return String.format("{\"event_type\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}", 
                eventType, message);
        }
    }
    
    /**
     * Create builder with mandatory fields from context.
     */
    public static StructuredLogEventBuilder fromContext(
            String service, String environment, LogEventType eventType, String level) {
        
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .correlationId(MDC.get(LoggingConfig.MDC_CORRELATION_ID))
            .chaosExperimentId(MDC.get(LoggingConfig.MDC_EXPERIMENT_ID));
    }
}
