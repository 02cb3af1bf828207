package com.platform.coverage.connectors.servicenow;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.connectors.AuthHeaders;
import com.platform.coverage.connectors.ConnectorSession;
import com.platform.coverage.connectors.SourceConnector;
import com.platform.coverage.core.PageUnwrapper;
import com.platform.coverage.core.PaginationParams;
import com.platform.coverage.core.RequestOutcome;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.model.ServerRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ServiceNow CMDB connector for the server table, optionally filtered by operating entity.
 */
@Slf4j
public class ServiceNowConnector implements SourceConnector<ServerRecord> {
    
    public static final String SOURCE = "servicenow";
    
    private static final int BEARER_KEY_MIN_LENGTH = 100;
    private static final int LOGGED_CUSTOM_FIELDS = 10;
    
    private final CoverageProperties.ServiceNow config;
    private final String operatingEntityFilter;
    private final String tableUrl;
    private final ServerNormalizer normalizer;
    private final ConnectorSession session;
    private final PaginationParams pagination;
    private volatile List<String> discoveredFields = List.of();
    
    public ServiceNowConnector(CoverageProperties.ServiceNow config, String operatingEntityFilter,
                               boolean hostnameUppercase, ConnectorSession.Resources resources) {
        this.config = config;
        this.operatingEntityFilter = operatingEntityFilter;
        this.tableUrl = config.getBaseUrl() + "/" + config.getTable();
        this.normalizer = new ServerNormalizer(hostnameUppercase);
        this.pagination = new PaginationParams("sysparm_offset", "sysparm_limit", config.getPageSize(), true);
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
    
    /**
     * Basic auth for plain user names with short keys, bearer token otherwise.
     */
    @Override
    public Map<String, String> authHeaders() {
        if (usesBasicAuth(config.getApiUser(), config.getApiKey())) {
            return AuthHeaders.basic(config.getApiUser(), config.getApiKey());
        }
        return AuthHeaders.bearer(config.getApiKey());
    }
    
    static boolean usesBasicAuth(String user, String key) {
        String safeUser = user != null ? user : "";
        String safeKey = key != null ? key : "";
        return !safeUser.contains("@") && safeKey.length() < BEARER_KEY_MIN_LENGTH;
    }
    
    @Override
    public boolean testConnection() {
        RequestOutcome outcome = session.client().execute("GET", tableUrl, Map.of("sysparm_limit", 1));
        boolean ok = outcome.isSuccess() && outcome.payload() != null && outcome.payload().has("result");
        if (!ok) {
            log.error("Connection test failed: {}", outcome.describe());
        }
        return ok;
    }
    
    /**
     * Number of rows matching the filter, from the {@code X-Total-Count} header. 0 when unavailable.
     */
    public long getTotalCount() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sysparm_limit", 1);
        params.put("sysparm_fields", "sys_id");
        String query = CmdbQueryBuilder.operatingEntityContains(operatingEntityFilter);
        if (!query.isEmpty()) {
            params.put("sysparm_query", query);
        }
        params.put("sysparm_count", "true");
        
        RequestOutcome outcome = session.client().execute("GET", tableUrl, params);
        if (!outcome.isSuccess()) {
            return 0;
        }
        String count = outcome.header("X-Total-Count");
        if (count == null) {
            return 0;
        }
        try {
            return Long.parseLong(count.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparsable X-Total-Count header: {}", count);
            return 0;
        }
    }
    
    @Override
    public List<ServerRecord> fetchAll() {
        log.info("Fetching servers from ServiceNow CMDB table: {}", config.getTable());
        
        Map<String, String> params = new LinkedHashMap<>();
        String query = CmdbQueryBuilder.operatingEntityContains(operatingEntityFilter);
        if (!query.isEmpty()) {
            log.info("Filter: Operating Entity contains '{}'", operatingEntityFilter);
            params.put("sysparm_query", query);
        }
        
        List<JsonNode> raw = session.paginator().fetchAll(tableUrl, pagination, params, PageUnwrapper.nested("result"));
        log.info("Fetched {} servers. Normalizing data...", raw.size());
        
        if (!raw.isEmpty()) {
            discoverFields(raw.get(0));
        }
        
        return raw.stream()
            .map(normalizer::normalize)
            .toList();
    }
    
    private void discoverFields(JsonNode sample) {
        List<String> fields = new ArrayList<>();
        Iterator<String> names = sample.fieldNames();
        names.forEachRemaining(fields::add);
        discoveredFields = List.copyOf(fields);
        
        List<String> custom = fields.stream().filter(f -> f.startsWith("u_")).toList();
        if (!custom.isEmpty()) {
            log.info("Discovered {} custom fields (u_*): {}", custom.size(),
                custom.subList(0, Math.min(LOGGED_CUSTOM_FIELDS, custom.size())));
        }
    }
    
    public String getTable() {
        return config.getTable();
    }
    
    /**
     * Field names of the first fetched row, empty before the first fetch.
     */
    public List<String> getDiscoveredFields() {
        return discoveredFields;
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
