package com.platform.coverage.observability;

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
 * One JSON line on the {@code structured.*} loggers.
 * Every event carries timestamp, level, service and event_type; run id and source come from MDC.
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
    private LogEventType eventType;
    
    private String runId;
    private String source;
    
    private String message;
    private String endpoint;
    private Long recordCount;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;
    
    private Map<String, Object> context;
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            // context maps may hold values Jackson cannot write
            return MAPPER.createObjectNode()
                .put("event_type", String.valueOf(eventType))
                .put("run_id", runId)
                .put("error", "serialization_failed")
                .toString();
        }
    }
    
    static StructuredLogEventBuilder of(String service, LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .eventType(eventType)
            .runId(MDC.get("run_id"))
            .source(MDC.get("source"));
    }
}
