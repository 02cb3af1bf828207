package com.platform.coverage.report;

import com.platform.coverage.model.ExecutionSummary;
import com.platform.coverage.reconciliation.ReconciliationResult;

import java.util.List;

/**
 * Consumer of a finished reconciliation.
 */
public interface ReportSink {
    
    String name();
    
    /**
     * Write the result somewhere.
     *
     * @return locations written, for logging
     * @throws com.platform.coverage.error.ReportExportException when nothing could be written
     */
    List<String> accept(ReconciliationResult result, ExecutionSummary summary);
}
