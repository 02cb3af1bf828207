package com.platform.coverage.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one audit run, phase timings included.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionSummary(
    String runId,
    Instant startTime,
    Instant endTime,
    Double illumioFetchSeconds,
    Double servicenowFetchSeconds,
    Double reconciliationSeconds,
    Double exportSeconds,
    int workloadsFetched,
    int serversFetched,
    int recordsReconciled,
    double coverageRate,
    boolean cmdbAvailable,
    Map<String, FetchStatsSnapshot> fetchStats,
    List<String> errors
) {
    
    public ExecutionSummary {
        fetchStats = fetchStats != null ? Map.copyOf(fetchStats) : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
    
    public boolean isSuccessful() {
        return errors.isEmpty();
    }
    
    public double totalSeconds() {
        if (startTime == null || endTime == null) {
            return 0;
        }
        return Duration.between(startTime, endTime).toMillis() / 1000.0;
    }
}
