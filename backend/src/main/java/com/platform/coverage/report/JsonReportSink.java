package com.platform.coverage.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.error.ReportExportException;
import com.platform.coverage.model.ExecutionSummary;
import com.platform.coverage.model.ReconciledRecord;
import com.platform.coverage.reconciliation.ReconciliationResult;
import com.platform.coverage.reconciliation.RecordFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the reconciled rows and the statistics as two JSON documents under the extracts folder.
 */
@Slf4j
@Component
public class JsonReportSink implements ReportSink {
    
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DATE_FOLDER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    
    private final CoverageProperties.Output output;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    @Autowired
    public JsonReportSink(CoverageProperties properties, ObjectMapper objectMapper) {
        this(properties.getOutput(), objectMapper, Clock.systemDefaultZone());
    }
    
    JsonReportSink(CoverageProperties.Output output, ObjectMapper objectMapper, Clock clock) {
        this.output = output;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }
    
    @Override
    public String name() {
        return "json";
    }
    
    @Override
    public List<String> accept(ReconciliationResult result, ExecutionSummary summary) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path directory = resolveDirectory(now);
        String timestamp = FILE_TIMESTAMP.format(now);
        
        Path recordsFile = directory.resolve(output.getFilePrefix() + "_reconciliation_" + timestamp + ".json");
        Path statsFile = directory.resolve(output.getFilePrefix() + "_stats_" + timestamp + ".json");
        
        try {
            Files.createDirectories(directory);
            
            List<Map<String, Object>> rows = result.records().stream()
                .map(ReconciledRecord::toRow)
                .toList();
            objectMapper.writeValue(recordsFile.toFile(), rows);
            
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("run_id", summary.runId());
            document.put("cmdb_available", result.cmdbAvailable());
            document.put("stats", result.stats());
            document.put("gaps", Map.of(
                "not_deployed", RecordFilters.notDeployed(result.records()).size(),
                "not_in_cmdb", RecordFilters.shadowIt(result.records()).size(),
                "offline_agents", RecordFilters.offlineAgents(result.records()).size(),
                "suspended_agents", RecordFilters.suspendedAgents(result.records()).size()));
            document.put("execution", summary);
            objectMapper.writeValue(statsFile.toFile(), document);
        } catch (IOException e) {
            throw new ReportExportException(name(), "Failed to write JSON report to " + directory, e);
        }
        
        log.info("Wrote {} reconciled rows to {}", result.records().size(), recordsFile);
        return List.of(recordsFile.toString(), statsFile.toString());
    }
    
    private Path resolveDirectory(LocalDateTime now) {
        Path directory = Path.of(output.getBasePath()).resolve(output.getExtractsFolder());
        if (output.isCreateDateSubfolder()) {
            directory = directory.resolve(DATE_FOLDER.format(now));
        }
        return directory;
    }
}
