package com.platform.coverage.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Aggregate statistics of one reconciliation. Rates are percentages.
 * Nested breakdowns map dimension value to status value to count.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconciliationStats(
    int totalCmdbServers,
    int totalIllumioWorkloads,
    int deployedActive,
    int deployedOffline,
    int deployedSuspended,
    int deployedUninstalled,
    int notDeployed,
    int notInCmdb,
    int matchedByHostname,
    double coverageRate,
    double activeRate,
    double enforcementRate,
    Map<String, Map<String, Integer>> byEnvironment,
    Map<String, Map<String, Integer>> byApplication,
    Map<String, Map<String, Integer>> byOperatingEntity,
    Map<String, Integer> byVenStatus,
    Map<String, Integer> byEnforcementMode,
    Map<String, Integer> byVenVersion
) {
    
    public int count(ReconciliationStatus status) {
        return switch (status) {
            case DEPLOYED_ACTIVE -> deployedActive;
            case DEPLOYED_OFFLINE -> deployedOffline;
            case DEPLOYED_SUSPENDED -> deployedSuspended;
            case DEPLOYED_UNINSTALLED -> deployedUninstalled;
            case NOT_DEPLOYED -> notDeployed;
            case NOT_IN_CMDB -> notInCmdb;
        };
    }
    
    /**
     * Records with a VEN in any state, uninstalled included.
     */
    public int totalDeployed() {
        return deployedActive + deployedOffline + deployedSuspended + deployedUninstalled;
    }
}
