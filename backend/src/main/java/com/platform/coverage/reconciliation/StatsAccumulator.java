package com.platform.coverage.reconciliation;

import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.model.ReconciliationStats;
import com.platform.coverage.model.ReconciliationStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects status counts and breakdown tables while records are emitted. Single-threaded.
 */
class StatsAccumulator {
    
    static final String UNKNOWN = "Unknown";
    static final String NOT_APPLICABLE = "N/A";
    
    private final Map<ReconciliationStatus, Integer> statusCounts = new EnumMap<>(ReconciliationStatus.class);
    private final Map<String, Map<String, Integer>> byEnvironment = new LinkedHashMap<>();
    private final Map<String, Map<String, Integer>> byApplication = new LinkedHashMap<>();
    private final Map<String, Map<String, Integer>> byOperatingEntity = new LinkedHashMap<>();
    private final Map<String, Integer> byVenStatus = new LinkedHashMap<>();
    private final Map<String, Integer> byEnforcementMode = new LinkedHashMap<>();
    private final Map<String, Integer> byVenVersion = new LinkedHashMap<>();
    private int matchedByHostname;
    
    void add(ReconciledRecord record) {
        ReconciliationStatus status = record.status();
        statusCounts.merge(status, 1, Integer::sum);
        
        String statusKey = status.getValue();
        nested(byEnvironment, orDefault(record.environment(), UNKNOWN), statusKey);
        nested(byApplication, orDefault(record.application(), UNKNOWN), statusKey);
        nested(byOperatingEntity, orDefault(record.operatingEntity(), UNKNOWN), statusKey);
        
        byVenStatus.merge(orDefault(record.venStatusLabel(), NOT_APPLICABLE), 1, Integer::sum);
        byEnforcementMode.merge(orDefault(record.enforcementMode(), NOT_APPLICABLE), 1, Integer::sum);
        byVenVersion.merge(orDefault(record.venVersion(), NOT_APPLICABLE), 1, Integer::sum);
    }
    
    void recordHostnameMatch() {
        matchedByHostname++;
    }
    
    ReconciliationStats build(int totalServers, int totalWorkloads) {
        int active = count(ReconciliationStatus.DEPLOYED_ACTIVE);
        int offline = count(ReconciliationStatus.DEPLOYED_OFFLINE);
        int suspended = count(ReconciliationStatus.DEPLOYED_SUSPENDED);
        int uninstalled = count(ReconciliationStatus.DEPLOYED_UNINSTALLED);
        
        double coverageRate = 0.0;
        double activeRate = 0.0;
        if (totalServers > 0) {
            coverageRate = percent(active + offline + suspended + uninstalled, totalServers);
            activeRate = percent(active, totalServers);
        }
        
        // uninstalled agents are not part of the enforcement denominator
        int currentlyDeployed = statusCounts.entrySet().stream()
            .filter(e -> e.getKey().isCurrentlyDeployed())
            .mapToInt(Map.Entry::getValue)
            .sum();
        double enforcementRate = 0.0;
        if (currentlyDeployed > 0) {
            int enforced = byEnforcementMode.getOrDefault("full", 0) + byEnforcementMode.getOrDefault("selective", 0);
            enforcementRate = percent(enforced, currentlyDeployed);
        }
        
        return new ReconciliationStats(
            totalServers,
            totalWorkloads,
            active,
            offline,
            suspended,
            uninstalled,
            count(ReconciliationStatus.NOT_DEPLOYED),
            count(ReconciliationStatus.NOT_IN_CMDB),
            matchedByHostname,
            coverageRate,
            activeRate,
            enforcementRate,
            copyNested(byEnvironment),
            copyNested(byApplication),
            copyNested(byOperatingEntity),
            Map.copyOf(byVenStatus),
            Map.copyOf(byEnforcementMode),
            Map.copyOf(byVenVersion));
    }
    
    private int count(ReconciliationStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
    
    private static void nested(Map<String, Map<String, Integer>> table, String dimension, String status) {
        table.computeIfAbsent(dimension, k -> new LinkedHashMap<>()).merge(status, 1, Integer::sum);
    }
    
    private static Map<String, Map<String, Integer>> copyNested(Map<String, Map<String, Integer>> table) {
        Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
        table.forEach((key, counts) -> copy.put(key, Map.copyOf(counts)));
        return Collections.unmodifiableMap(copy);
    }
    
    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
    
    private static double percent(int part, int whole) {
        return part * 100.0 / whole;
    }
}
