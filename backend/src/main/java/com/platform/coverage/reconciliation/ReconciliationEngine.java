package com.platform.coverage.reconciliation;

import com.platform.coverage.model.MatchType;
import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.model.ReconciliationStats;
import com.platform.coverage.model.ReconciliationStatus;
import com.platform.coverage.model.ServerRecord;
import com.platform.coverage.model.VenStatus;
import com.platform.coverage.model.WorkloadRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins Illumio workloads with CMDB servers on the normalized hostname.
 *
 * Every server yields one record. Every workload not matched by a server yields one
 * {@code not_in_cmdb} record. Without CMDB data every workload is classified on its own
 * state with match type {@code illumio_only}. Pure and single-threaded; never throws on data.
 */
@Slf4j
@Component
public class ReconciliationEngine {
    
    /**
     * @param workloads normalized workloads
     * @param servers normalized servers, or null when the CMDB is unavailable
     */
    public ReconciliationResult reconcile(List<WorkloadRecord> workloads, List<ServerRecord> servers) {
        if (servers == null) {
            log.info("No CMDB data - performing Illumio-only analysis");
            return illumioOnly(workloads);
        }
        
        log.info("Reconciling {} workloads with {} servers", workloads.size(), servers.size());
        
        Map<String, WorkloadRecord> byHostname = new LinkedHashMap<>();
        List<WorkloadRecord> withoutHostname = new ArrayList<>();
        for (WorkloadRecord workload : workloads) {
            if (!workload.hasHostname()) {
                withoutHostname.add(workload);
                continue;
            }
            WorkloadRecord previous = byHostname.put(workload.getHostnameNormalized(), workload);
            if (previous != null) {
                log.debug("Duplicate workload hostname {}: {} replaces {}",
                    workload.getHostnameNormalized(), workload.getHref(), previous.getHref());
            }
        }
        
        StatsAccumulator accumulator = new StatsAccumulator();
        List<ReconciledRecord> records = new ArrayList<>(servers.size() + workloads.size());
        Set<String> consumed = new HashSet<>();
        
        for (ServerRecord server : servers) {
            String hostname = server.getHostnameNormalized();
            WorkloadRecord workload = server.hasHostname() ? byHostname.get(hostname) : null;
            
            ReconciledRecord record;
            if (workload != null) {
                consumed.add(hostname);
                accumulator.recordHostnameMatch();
                record = new ReconciledRecord(hostname, workload, server, statusOf(workload), MatchType.HOSTNAME);
            } else {
                record = new ReconciledRecord(hostname, null, server, ReconciliationStatus.NOT_DEPLOYED, MatchType.NONE);
            }
            accumulator.add(record);
            records.add(record);
        }
        
        byHostname.forEach((hostname, workload) -> {
            if (!consumed.contains(hostname)) {
                emitShadow(workload, accumulator, records);
            }
        });
        withoutHostname.forEach(workload -> emitShadow(workload, accumulator, records));
        
        ReconciliationStats stats = accumulator.build(servers.size(), workloads.size());
        log.info("Reconciliation complete: {} records, coverage {}%", records.size(),
            String.format("%.1f", stats.coverageRate()));
        return new ReconciliationResult(records, stats, true);
    }
    
    private ReconciliationResult illumioOnly(List<WorkloadRecord> workloads) {
        StatsAccumulator accumulator = new StatsAccumulator();
        List<ReconciledRecord> records = new ArrayList<>(workloads.size());
        for (WorkloadRecord workload : workloads) {
            ReconciledRecord record = new ReconciledRecord(
                workload.getHostnameNormalized(), workload, null, statusOf(workload), MatchType.ILLUMIO_ONLY);
            accumulator.add(record);
            records.add(record);
        }
        return new ReconciliationResult(records, accumulator.build(0, workloads.size()), false);
    }
    
    private static void emitShadow(WorkloadRecord workload, StatsAccumulator accumulator, List<ReconciledRecord> records) {
        ReconciledRecord record = new ReconciledRecord(
            workload.getHostnameNormalized(), workload, null, ReconciliationStatus.NOT_IN_CMDB, MatchType.NONE);
        accumulator.add(record);
        records.add(record);
    }
    
    /**
     * Deployment status of a workload from its management flag, VEN status and online flag.
     */
    static ReconciliationStatus statusOf(WorkloadRecord workload) {
        if (!workload.isManaged()) {
            return ReconciliationStatus.DEPLOYED_UNINSTALLED;
        }
        VenStatus venStatus = workload.getVenStatus() != null ? workload.getVenStatus() : VenStatus.OTHER;
        return switch (venStatus) {
            case SUSPENDED -> ReconciliationStatus.DEPLOYED_SUSPENDED;
            case UNINSTALLED -> ReconciliationStatus.DEPLOYED_UNINSTALLED;
            case ACTIVE, OFFLINE, UNMANAGED, OTHER -> workload.isOnline()
                ? ReconciliationStatus.DEPLOYED_ACTIVE
                : ReconciliationStatus.DEPLOYED_OFFLINE;
        };
    }
}
