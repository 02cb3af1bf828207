package com.platform.coverage.reconciliation;

import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.model.VenStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.platform.coverage.support.Records.server;
import static com.platform.coverage.support.Records.workload;
import static org.assertj.core.api.Assertions.assertThat;

class RecordFiltersTest {
    
    @Test
    void filtersSelectByStatus() {
        List<ReconciledRecord> records = new ReconciliationEngine().reconcile(
            List.of(
                workload("A").build(),
                workload("B").online(false).venStatus(VenStatus.OFFLINE).build(),
                workload("C").venStatus(VenStatus.SUSPENDED).build(),
                workload("SHADOW").build()),
            List.of(server("A").build(), server("B").build(), server("C").build(), server("GAP").build()))
            .records();
        
        assertThat(RecordFilters.notDeployed(records)).extracting(ReconciledRecord::hostnameNormalized).containsExactly("GAP");
        assertThat(RecordFilters.shadowIt(records)).extracting(ReconciledRecord::hostnameNormalized).containsExactly("SHADOW");
        assertThat(RecordFilters.offlineAgents(records)).extracting(ReconciledRecord::hostnameNormalized).containsExactly("B");
        assertThat(RecordFilters.suspendedAgents(records)).extracting(ReconciledRecord::hostnameNormalized).containsExactly("C");
    }
}
