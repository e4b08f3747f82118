package com.platform.gatewayctl.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 * <p>
 * Mandatory fields: timestamp, level, service, eventType.
 * The API name, route and step are copied from the MDC when present.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    // Mandatory fields
    private Instant timestamp;
    private String level;
    private String service;
    private LogEventType eventType;
    
    // Run context (from MDC)
    private String apiName;
    private String route;
    private String step;
    
    // Event-specific data
    private String message;
    private String target;
    private String outcome;
    private String deploymentId;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;
    
    private Map<String, Object> context;
    
    /**
     * Convert to JSON string for logging.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"eventType\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, message);
        }
    }
    
    /**
     * Create builder with mandatory fields and the current MDC context.
     */
    public static StructuredLogEventBuilder fromContext(String service, LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now())
            .level(level)
            .service(service)
            .eventType(eventType)
            .apiName(MDC.get("apiName"))
            .route(MDC.get("route"))
            .step(MDC.get("step"));
    }
}
