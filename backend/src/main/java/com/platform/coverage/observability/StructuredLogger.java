package com.platform.coverage.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Machine-parsable audit trail of a run, next to the regular class loggers.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    
    public StructuredLogger(@Value("${spring.application.name:coverage-auditor}") String serviceName) {
        this.serviceName = serviceName;
    }
    
    public SourceLogger source() {
        return new SourceLogger(serviceName);
    }
    
    public RunLogger run() {
        return new RunLogger(serviceName);
    }
    
    // ==================== SOURCE LOGGER ====================
    
    public static class SourceLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.source");
        private final String service;
        
        SourceLogger(String service) {
            this.service = service;
        }
        
        public void connected(String source, String endpoint) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.SOURCE_CONNECTED, "INFO")
                .source(source)
                .endpoint(endpoint)
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void connectionFailed(String source, String endpoint, String errorCode) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.SOURCE_CONNECTION_FAILED, "WARN")
                .source(source)
                .endpoint(endpoint)
                .success(false)
                .errorCode(errorCode)
                .build();
            log.warn(event.toJson());
        }
        
        public void fetchStarted(String source, String endpoint) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.SOURCE_FETCH_STARTED, "INFO")
                .source(source)
                .endpoint(endpoint)
                .build();
            log.info(event.toJson());
        }
        
        public void fetchCompleted(String source, long recordCount, long durationMs, Map<String, Object> requestStats) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.SOURCE_FETCH_COMPLETED, "INFO")
                .source(source)
                .recordCount(recordCount)
                .durationMs(durationMs)
                .success(true)
                .context(requestStats)
                .build();
            log.info(event.toJson());
        }
        
        public void fetchFailed(String source, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.SOURCE_FETCH_FAILED, "ERROR")
                .source(source)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void degradedMode(String source, String reason) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.DEGRADED_MODE_ENTERED, "WARN")
                .source(source)
                .message(reason)
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== RUN LOGGER ====================
    
    public static class RunLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.run");
        private final String service;
        
        RunLogger(String service) {
            this.service = service;
        }
        
        public void reconciliationCompleted(long recordCount, double coverageRate, boolean cmdbAvailable, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.RECONCILIATION_COMPLETED, "INFO")
                .recordCount(recordCount)
                .durationMs(durationMs)
                .success(true)
                .context(Map.of(
                    "coverage_rate", coverageRate,
                    "cmdb_available", cmdbAvailable))
                .build();
            log.info(event.toJson());
        }
        
        public void reportWritten(String sink, String location) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.REPORT_WRITTEN, "INFO")
                .message(sink)
                .endpoint(location)
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void reportFailed(String sink, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.REPORT_FAILED, "WARN")
                .message(sink)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.warn(event.toJson());
        }
        
        public void completed(boolean success, long durationMs, int errorCount) {
            StructuredLogEvent event = StructuredLogEvent.of(service, LogEventType.RUN_COMPLETED, success ? "INFO" : "WARN")
                .success(success)
                .durationMs(durationMs)
                .context(Map.of("error_count", errorCount))
                .build();
            if (success) {
                log.info(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }
    }
}
