package com.platform.coverage.connectors.illumio;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.connectors.AuthHeaders;
import com.platform.coverage.connectors.ConnectorSession;
import com.platform.coverage.connectors.SourceConnector;
import com.platform.coverage.core.PageUnwrapper;
import com.platform.coverage.core.PaginationParams;
import com.platform.coverage.core.RequestOutcome;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.model.WorkloadRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Illumio PCE connector. Reads labels and workloads from the org-scoped v2 API.
 */
@Slf4j
public class IllumioConnector implements SourceConnector<WorkloadRecord> {
    
    public static final String SOURCE = "illumio";
    
    private final CoverageProperties.Illumio config;
    private final boolean hostnameUppercase;
    private final String baseUrl;
    private final ConnectorSession session;
    private final PaginationParams pagination;
    private volatile Map<String, WorkloadEnricher.Label> labels = Map.of();
    
    public IllumioConnector(CoverageProperties.Illumio config, boolean hostnameUppercase,
                            ConnectorSession.Resources resources) {
        this.config = config;
        this.hostnameUppercase = hostnameUppercase;
        this.baseUrl = config.getBaseUrl();
        this.pagination = new PaginationParams("offset", "max_results", config.getPageSize(), false);
        this.session = ConnectorSession.open(
            SOURCE,
            authHeaders(),
            config.getMaxConcurrentRequests(),
            config.getTimeout(),
            resources);
    }
    
    @Override
    public String sourceName() {
        return SOURCE;
    }
    
    @Override
    public Map<String, String> authHeaders() {
        return AuthHeaders.basic(config.getApiUser(), config.getApiSecret());
    }
    
    @Override
    public boolean testConnection() {
        RequestOutcome outcome = session.client().execute("GET", baseUrl + "/workloads", Map.of("max_results", 1));
        if (!outcome.isSuccess()) {
            log.error("Connection test failed: {}", outcome.describe());
        }
        return outcome.isSuccess();
    }
    
    /**
     * Fetch every label and cache the href lookup used to enrich workloads.
     */
    public Map<String, WorkloadEnricher.Label> fetchLabels() {
        log.info("Fetching labels from PCE...");
        List<JsonNode> raw = session.paginator().fetchAll(
            baseUrl + "/labels", pagination, Map.of(), PageUnwrapper.bareArray());
        
        Map<String, WorkloadEnricher.Label> byHref = new LinkedHashMap<>();
        for (JsonNode label : raw) {
            String href = WorkloadEnricher.text(label, "href");
            if (!href.isEmpty()) {
                byHref.put(href, new WorkloadEnricher.Label(
                    WorkloadEnricher.text(label, "key"),
                    WorkloadEnricher.text(label, "value")));
            }
        }
        labels = Collections.unmodifiableMap(byHref);
        log.info("Fetched {} labels", byHref.size());
        return labels;
    }
    
    @Override
    public List<WorkloadRecord> fetchAll() {
        fetchLabels();
        
        log.info("Fetching workloads from PCE...");
        List<JsonNode> raw = session.paginator().fetchAll(
            baseUrl + "/workloads", pagination, Map.of(), PageUnwrapper.bareArray());
        log.info("Fetched {} workloads. Enriching data...", raw.size());
        
        WorkloadEnricher enricher = new WorkloadEnricher(labels, hostnameUppercase);
        return raw.stream()
            .map(enricher::enrich)
            .toList();
    }
    
    /**
     * PCE health document, or empty when it cannot be read.
     */
    public Optional<JsonNode> fetchHealth() {
        RequestOutcome outcome = session.client().execute("GET", baseUrl + "/health", Map.of());
        return outcome.isSuccess() ? Optional.ofNullable(outcome.payload()) : Optional.empty();
    }
    
    @Override
    public FetchStatsSnapshot stats() {
        return session.stats().snapshot();
    }
    
    @Override
    public void close() {
        session.close();
    }
}
