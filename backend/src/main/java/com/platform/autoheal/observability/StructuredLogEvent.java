package com.platform.autoheal.observability;

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
 * Mandatory fields: timestamp, level, service, environment, event_type, actor.
 * Correlation fields are copied from the MDC.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    private String actor;

    private String correlationId;
    private String cycleId;

    private String message;
    private String workload;
    private String action;
    private Integer attempt;
    private Double probability;
    private Boolean degraded;
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
            .cycleId(MDC.get(LoggingConfig.MDC_CYCLE_ID));
    }
}
