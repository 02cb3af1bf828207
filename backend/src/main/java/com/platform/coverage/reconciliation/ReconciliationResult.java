package com.platform.coverage.reconciliation;

import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.model.ReconciliationStats;

import java.util.List;

/**
 * Reconciled records and their statistics.
 *
 * @param cmdbAvailable false when the run reconciled workloads alone
 */
public record ReconciliationResult(
    List<ReconciledRecord> records,
    ReconciliationStats stats,
    boolean cmdbAvailable
) {
    
    public ReconciliationResult {
        records = List.copyOf(records);
    }
}
