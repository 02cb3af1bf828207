package com.platform.coverage.core;

import com.platform.coverage.connectors.ConnectorFactory;
import com.platform.coverage.connectors.SourceConnector;
import com.platform.coverage.connectors.illumio.IllumioConnector;
import com.platform.coverage.connectors.servicenow.ServiceNowConnector;
import com.platform.coverage.error.CoverageException;
import com.platform.coverage.error.ErrorCode;
import com.platform.coverage.error.SourceUnavailableException;
import com.platform.coverage.model.ExecutionSummary;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.model.ServerRecord;
import com.platform.coverage.model.WorkloadRecord;
import com.platform.coverage.observability.MetricsRegistry;
import com.platform.coverage.observability.StructuredLogger;
import com.platform.coverage.reconciliation.ReconciliationEngine;
import com.platform.coverage.reconciliation.ReconciliationResult;
import com.platform.coverage.report.ReportSink;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs one audit: fetch both inventories concurrently, reconcile, hand the result to every sink.
 *
 * The Illumio fetch is mandatory. A ServiceNow failure degrades the run to Illumio-only
 * analysis and is recorded as an error. Sink failures are recorded and never abort the run.
 */
@Slf4j
@Service
public class AuditOrchestrator {
    
    private static final String SEPARATOR = "=".repeat(60);
    private static final String RULE = "-".repeat(40);
    
    private final ConnectorFactory connectorFactory;
    private final ReconciliationEngine reconciliationEngine;
    private final List<ReportSink> reportSinks;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public AuditOrchestrator(
            ConnectorFactory connectorFactory,
            ReconciliationEngine reconciliationEngine,
            List<ReportSink> reportSinks,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.connectorFactory = connectorFactory;
        this.reconciliationEngine = reconciliationEngine;
        this.reportSinks = reportSinks;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    /**
     * Execute a full run.
     *
     * @throws SourceUnavailableException when Illumio cannot be read
     * @throws com.platform.coverage.error.ConfigurationException when Illumio credentials are missing
     */
    public ExecutionSummary run() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("run_id", runId);
        Instant start = Instant.now();
        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        
        log.info(SEPARATOR);
        log.info("Coverage audit {} - Starting", runId);
        log.info(SEPARATOR);
        
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("audit-" + runId + "-");
        threadFactory.setDaemon(true);
        ExecutorService fetchers = Executors.newFixedThreadPool(2, threadFactory);
        
        try {
            CompletableFuture<SourceFetch<ServerRecord>> cmdbFuture = connectorFactory.isServiceNowEnabled()
                ? CompletableFuture.supplyAsync(withMdc(() -> fetchServiceNow(errors)), fetchers)
                : CompletableFuture.completedFuture(SourceFetch.skipped(ServiceNowConnector.SOURCE));
            
            SourceFetch<WorkloadRecord> workloads;
            try {
                workloads = CompletableFuture.supplyAsync(withMdc(this::fetchIllumio), fetchers).join();
            } catch (CompletionException e) {
                cmdbFuture.exceptionally(ex -> null).join();
                throw unwrap(e);
            }
            SourceFetch<ServerRecord> servers = cmdbFuture.join();
            
            if (servers.records() == null && connectorFactory.isServiceNowEnabled()) {
                structuredLogger.source().degradedMode(ServiceNowConnector.SOURCE, "Continuing with Illumio-only analysis");
            }
            
            log.info(RULE);
            log.info("Reconciling data...");
            Instant reconcileStart = Instant.now();
            ReconciliationResult result = reconciliationEngine.reconcile(workloads.records(), servers.records());
            double reconcileSeconds = secondsSince(reconcileStart);
            metricsRegistry.recordReconciliation(result.stats());
            structuredLogger.run().reconciliationCompleted(result.records().size(), result.stats().coverageRate(),
                result.cmdbAvailable(), Math.round(reconcileSeconds * 1000));
            
            Map<String, FetchStatsSnapshot> fetchStats = new LinkedHashMap<>();
            fetchStats.put(IllumioConnector.SOURCE, workloads.stats());
            fetchStats.put(ServiceNowConnector.SOURCE, servers.stats());
            
            Instant exportStart = Instant.now();
            ExecutionSummary provisional = summary(runId, start, Instant.now(), workloads, servers, reconcileSeconds,
                null, result, fetchStats, errors);
            exportReports(result, provisional, errors);
            double exportSeconds = secondsSince(exportStart);
            
            ExecutionSummary summary = summary(runId, start, Instant.now(), workloads, servers, reconcileSeconds,
                exportSeconds, result, fetchStats, errors);
            logSummary(summary);
            structuredLogger.run().completed(summary.isSuccessful(), Math.round(summary.totalSeconds() * 1000),
                summary.errors().size());
            return summary;
        } finally {
            fetchers.shutdown();
            MDC.remove("run_id");
        }
    }
    
    private SourceFetch<WorkloadRecord> fetchIllumio() {
        log.info(RULE);
        log.info("Fetching data from Illumio PCE...");
        Instant start = Instant.now();
        
        try (IllumioConnector connector = connectorFactory.illumio()) {
            if (!connector.testConnection()) {
                structuredLogger.source().connectionFailed(connector.sourceName(), "/workloads",
                    ErrorCode.PCE_UNAVAILABLE.getCode());
                throw SourceUnavailableException.pce("Failed to connect to Illumio PCE");
            }
            structuredLogger.source().connected(connector.sourceName(), "/workloads");
            log.info("Connected to Illumio PCE successfully");
            
            List<WorkloadRecord> workloads = fetchRecords(connector);
            return new SourceFetch<>(workloads, secondsSince(start), connector.stats());
        } catch (CoverageException e) {
            structuredLogger.source().fetchFailed(IllumioConnector.SOURCE, e.getErrorCode().getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            structuredLogger.source().fetchFailed(IllumioConnector.SOURCE, ErrorCode.PCE_FETCH_FAILED.getCode(),
                e.getMessage());
            throw new SourceUnavailableException(ErrorCode.PCE_FETCH_FAILED, IllumioConnector.SOURCE,
                "Illumio fetch error: " + e.getMessage(), e);
        }
    }
    
    private SourceFetch<ServerRecord> fetchServiceNow(List<String> errors) {
        log.info(RULE);
        log.info("Fetching data from ServiceNow CMDB...");
        Instant start = Instant.now();
        
        try (ServiceNowConnector connector = connectorFactory.servicenow()) {
            if (!connector.testConnection()) {
                log.warn("Failed to connect to ServiceNow CMDB");
                log.warn("Continuing with Illumio-only analysis");
                structuredLogger.source().connectionFailed(connector.sourceName(), "/" + connector.getTable(),
                    ErrorCode.CMDB_UNAVAILABLE.getCode());
                errors.add("ServiceNow connection failed - continuing without CMDB");
                return new SourceFetch<>(null, secondsSince(start), connector.stats());
            }
            structuredLogger.source().connected(connector.sourceName(), "/" + connector.getTable());
            log.info("Connected to ServiceNow successfully");
            
            List<ServerRecord> servers = fetchRecords(connector);
            log.info("Discovered {} fields in CMDB", connector.getDiscoveredFields().size());
            return new SourceFetch<>(servers, secondsSince(start), connector.stats());
        } catch (RuntimeException e) {
            log.warn("Error fetching ServiceNow data: {}", e.getMessage());
            log.warn("Continuing with Illumio-only analysis");
            String code = e instanceof CoverageException ce
                ? ce.getErrorCode().getCode()
                : ErrorCode.CMDB_FETCH_FAILED.getCode();
            structuredLogger.source().fetchFailed(ServiceNowConnector.SOURCE, code, e.getMessage());
            errors.add("ServiceNow fetch error: " + e.getMessage());
            return new SourceFetch<>(null, secondsSince(start), FetchStatsSnapshot.empty(ServiceNowConnector.SOURCE));
        }
    }
    
    private <T> List<T> fetchRecords(SourceConnector<T> connector) {
        String source = connector.sourceName();
        MDC.put("source", source);
        try {
            structuredLogger.source().fetchStarted(source, null);
            long started = System.currentTimeMillis();
            List<T> records = connector.fetchAll();
            long durationMs = System.currentTimeMillis() - started;
            
            FetchStatsSnapshot stats = connector.stats();
            metricsRegistry.recordRecordsFetched(source, records.size());
            metricsRegistry.recordLatency(source, "fetch", durationMs);
            structuredLogger.source().fetchCompleted(source, records.size(), durationMs, stats.toMap());
            log.info("[{}] Fetched {} records, stats: {}", source, records.size(), stats.toMap());
            return records;
        } finally {
            MDC.remove("source");
        }
    }
    
    private void exportReports(ReconciliationResult result, ExecutionSummary summary, List<String> errors) {
        for (ReportSink sink : reportSinks) {
            log.info(RULE);
            log.info("Generating {} report...", sink.name());
            try {
                List<String> locations = sink.accept(result, summary);
                locations.forEach(location -> structuredLogger.run().reportWritten(sink.name(), location));
            } catch (CoverageException e) {
                log.error("Error generating {} report: {}", sink.name(), e.getMessage(), e);
                structuredLogger.run().reportFailed(sink.name(), e.getErrorCode().getCode(), e.getMessage());
                errors.add("Report " + sink.name() + " error: " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error in {} report", sink.name(), e);
                structuredLogger.run().reportFailed(sink.name(), ErrorCode.UNEXPECTED_ERROR.getCode(), e.getMessage());
                errors.add("Report " + sink.name() + " error: " + e.getMessage());
            }
        }
    }
    
    private static ExecutionSummary summary(String runId, Instant start, Instant end,
                                            SourceFetch<WorkloadRecord> workloads, SourceFetch<ServerRecord> servers,
                                            double reconcileSeconds, Double exportSeconds,
                                            ReconciliationResult result, Map<String, FetchStatsSnapshot> fetchStats,
                                            List<String> errors) {
        List<String> errorsCopy;
        synchronized (errors) {
            errorsCopy = List.copyOf(errors);
        }
        return new ExecutionSummary(
            runId,
            start,
            end,
            workloads.seconds(),
            servers.seconds(),
            reconcileSeconds,
            exportSeconds,
            workloads.size(),
            servers.size(),
            result.records().size(),
            result.stats().coverageRate(),
            result.cmdbAvailable(),
            fetchStats,
            errorsCopy);
    }
    
    private void logSummary(ExecutionSummary summary) {
        log.info(SEPARATOR);
        log.info("EXECUTION SUMMARY");
        log.info(SEPARATOR);
        log.info("Total duration: {} seconds", format(summary.totalSeconds()));
        log.info("Illumio fetch: {}s", format(summary.illumioFetchSeconds()));
        log.info("ServiceNow fetch: {}s", format(summary.servicenowFetchSeconds()));
        log.info("Reconciliation: {}s", format(summary.reconciliationSeconds()));
        log.info("Export generation: {}s", format(summary.exportSeconds()));
        log.info(RULE);
        log.info("Workloads fetched: {}", summary.workloadsFetched());
        log.info("Servers fetched: {}", summary.serversFetched());
        log.info("Records reconciled: {}", summary.recordsReconciled());
        log.info("Coverage rate: {}%", format(summary.coverageRate()));
        log.info("CMDB available: {}", summary.cmdbAvailable());
        
        if (!summary.errors().isEmpty()) {
            log.warn(RULE);
            log.warn("Errors encountered: {}", summary.errors().size());
            summary.errors().forEach(error -> log.warn("  - {}", error));
        }
        
        log.info(SEPARATOR);
        log.info("Execution complete");
        log.info(SEPARATOR);
    }
    
    private static String format(Double value) {
        return String.format("%.2f", value != null ? value : 0.0);
    }
    
    private static double secondsSince(Instant start) {
        return Duration.between(start, Instant.now()).toMillis() / 1000.0;
    }
    
    private static RuntimeException unwrap(CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
            return cause;
        }
        return new SourceUnavailableException(ErrorCode.UNEXPECTED_ERROR, IllumioConnector.SOURCE,
            "Illumio fetch failed", e.getCause());
    }
    
    private static <T> Supplier<T> withMdc(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.get();
            } finally {
                MDC.clear();
            }
        };
    }
    
    /**
     * Records of one source, or null records when the source was skipped or unavailable.
     */
    private record SourceFetch<T>(List<T> records, Double seconds, FetchStatsSnapshot stats) {
        
        static <T> SourceFetch<T> skipped(String source) {
            return new SourceFetch<>(null, null, FetchStatsSnapshot.empty(source));
        }
        
        int size() {
            return records != null ? records.size() : 0;
        }
    }
}
