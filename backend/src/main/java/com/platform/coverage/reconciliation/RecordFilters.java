package com.platform.coverage.reconciliation;

import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.model.ReconciliationStatus;

import java.util.List;

/**
 * Views over reconciled records used by reports.
 */
public final class RecordFilters {
    
    private RecordFilters() {
    }
    
    /**
     * CMDB servers without a VEN.
     */
    public static List<ReconciledRecord> notDeployed(List<ReconciledRecord> records) {
        return withStatus(records, ReconciliationStatus.NOT_DEPLOYED);
    }
    
    /**
     * Workloads unknown to the CMDB.
     */
    public static List<ReconciledRecord> shadowIt(List<ReconciledRecord> records) {
        return withStatus(records, ReconciliationStatus.NOT_IN_CMDB);
    }
    
    public static List<ReconciledRecord> offlineAgents(List<ReconciledRecord> records) {
        return withStatus(records, ReconciliationStatus.DEPLOYED_OFFLINE);
    }
    
    public static List<ReconciledRecord> suspendedAgents(List<ReconciledRecord> records) {
        return withStatus(records, ReconciliationStatus.DEPLOYED_SUSPENDED);
    }
    
    public static List<ReconciledRecord> withStatus(List<ReconciledRecord> records, ReconciliationStatus status) {
        return records.stream()
            .filter(r -> r.status() == status)
            .toList();
    }
}
