package com.platform.coverage.observability;

/**
 * Event types emitted through {@link StructuredLogger}.
 */
public enum LogEventType {
    SOURCE_CONNECTED,
    SOURCE_CONNECTION_FAILED,
    SOURCE_FETCH_STARTED,
    SOURCE_FETCH_COMPLETED,
    SOURCE_FETCH_FAILED,
    DEGRADED_MODE_ENTERED,
    RECONCILIATION_COMPLETED,
    REPORT_WRITTEN,
    REPORT_FAILED,
    RUN_COMPLETED
}
