package com.platform.coverage.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.error.ReportExportException;
import com.platform.coverage.model.ExecutionSummary;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.reconciliation.ReconciliationEngine;
import com.platform.coverage.reconciliation.ReconciliationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.platform.coverage.support.Records.server;
import static com.platform.coverage.support.Records.workload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonReportSinkTest {
    
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
    
    @TempDir
    Path tempDir;
    
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private CoverageProperties.Output output;
    private ReconciliationResult result;
    private ExecutionSummary summary;
    
    @BeforeEach
    void setUp() {
        output = new CoverageProperties.Output();
        output.setBasePath(tempDir.toString());
        
        result = new ReconciliationEngine().reconcile(
            List.of(workload("WEB01").build(), workload("WEB02").build()),
            List.of(server("WEB01").build(), server("DB01").build()));
        summary = new ExecutionSummary("run1", CLOCK.instant(), CLOCK.instant(), 1.0, 2.0, 0.1, null,
            2, 2, result.records().size(), result.stats().coverageRate(), true,
            Map.of("illumio", FetchStatsSnapshot.empty("illumio")), List.of());
    }
    
    @Test
    void writesRowsAndStatsUnderDatedFolder() throws Exception {
        List<String> written = new JsonReportSink(output, mapper, CLOCK).accept(result, summary);
        
        Path folder = tempDir.resolve("extracts").resolve("2024-05-01");
        Path rowsFile = folder.resolve("illumio_monitoring_reconciliation_20240501_101530.json");
        Path statsFile = folder.resolve("illumio_monitoring_stats_20240501_101530.json");
        assertThat(written).containsExactly(rowsFile.toString(), statsFile.toString());
        
        JsonNode rows = mapper.readTree(Files.readString(rowsFile));
        assertThat(rows).hasSize(3);
        JsonNode first = rows.get(0);
        assertThat(first.get("cmdb_sys_id").asText()).isEqualTo("sys-WEB01");
        assertThat(first.get("illumio_online").asText()).isEqualTo("Yes");
        assertThat(first.get("reconciliation_status").asText()).isEqualTo("deployed_active");
        assertThat(first.get("match_type").asText()).isEqualTo("hostname");
        
        JsonNode stats = mapper.readTree(Files.readString(statsFile));
        assertThat(stats.get("run_id").asText()).isEqualTo("run1");
        assertThat(stats.get("cmdb_available").asBoolean()).isTrue();
        assertThat(stats.at("/stats/coverage_rate").asDouble()).isEqualTo(50.0);
        assertThat(stats.at("/stats/not_in_cmdb").asInt()).isEqualTo(1);
        assertThat(stats.at("/gaps/not_deployed").asInt()).isEqualTo(1);
        assertThat(stats.at("/execution/records_reconciled").asInt()).isEqualTo(3);
    }
    
    @Test
    void withoutDateFolderWritesDirectlyIntoExtracts() {
        output.setCreateDateSubfolder(false);
        output.setFilePrefix("audit");
        
        List<String> written = new JsonReportSink(output, mapper, CLOCK).accept(result, summary);
        
        assertThat(Path.of(written.get(0)).getParent()).isEqualTo(tempDir.resolve("extracts"));
        assertThat(Path.of(written.get(0)).getFileName().toString()).startsWith("audit_reconciliation_");
    }
    
    @Test
    void unwritableLocationRaisesExportError() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        output.setBasePath(blocker.toString());
        
        JsonReportSink sink = new JsonReportSink(output, mapper, CLOCK);
        
        assertThatThrownBy(() -> sink.accept(result, summary))
            .isInstanceOf(ReportExportException.class)
            .satisfies(e -> assertThat(((ReportExportException) e).getSinkName()).isEqualTo("json"));
    }
}
