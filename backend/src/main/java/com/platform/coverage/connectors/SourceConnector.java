package com.platform.coverage.connectors;

import com.platform.coverage.model.FetchStatsSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Contract for an inventory source. An instance owns one session: its worker pool, its
 * admission gate and its request counters. Closing it ends the session.
 *
 * @param <T> normalized record type produced by the source
 */
public interface SourceConnector<T> extends AutoCloseable {
    
    /**
     * Short source name used in logs, metrics and fetch statistics.
     */
    String sourceName();
    
    /**
     * Headers sent with every request of this source.
     */
    Map<String, String> authHeaders();
    
    /**
     * Probe the source with a minimal request. Never throws.
     */
    boolean testConnection();
    
    /**
     * Fetch and normalize every record. Pages that cannot be fetched are skipped.
     */
    List<T> fetchAll();
    
    FetchStatsSnapshot stats();
    
    @Override
    void close();
}
