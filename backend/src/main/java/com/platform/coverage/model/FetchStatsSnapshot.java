package com.platform.coverage.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of a connector's request counters.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FetchStatsSnapshot(
    String source,
    long requestsMade,
    long requestsSuccessful,
    long requestsFailed,
    long retries,
    Instant startTime,
    Instant endTime,
    Double durationSeconds
) {
    
    public static FetchStatsSnapshot of(String source, long made, long successful, long failed, long retries,
                                        Instant start, Instant end) {
        Double duration = null;
        if (start != null && end != null) {
            duration = Duration.between(start, end).toMillis() / 1000.0;
        }
        return new FetchStatsSnapshot(source, made, successful, failed, retries, start, end, duration);
    }
    
    public static FetchStatsSnapshot empty(String source) {
        return of(source, 0, 0, 0, 0, null, null);
    }
    
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("requests_made", requestsMade);
        map.put("requests_successful", requestsSuccessful);
        map.put("requests_failed", requestsFailed);
        map.put("retries", retries);
        if (durationSeconds != null) {
            map.put("duration_seconds", durationSeconds);
        }
        return map;
    }
}
