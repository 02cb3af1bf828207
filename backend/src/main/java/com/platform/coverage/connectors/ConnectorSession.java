package com.platform.coverage.connectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.RetryPolicy;
import com.platform.coverage.core.ConcurrentPaginator;
import com.platform.coverage.core.FetchStats;
import com.platform.coverage.core.HttpTransport;
import com.platform.coverage.core.RetryingHttpClient;
import com.platform.coverage.core.Sleeper;
import com.platform.coverage.observability.MetricsRegistry;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Per-connector resources: a fixed worker pool, a bulkhead of the same size, request counters,
 * and the client and paginator built on top of them. Nothing here is shared between connectors.
 */
@Slf4j
public class ConnectorSession implements AutoCloseable {
    
    private static final long SHUTDOWN_WAIT_SECONDS = 5;
    
    private final String source;
    private final ExecutorService executor;
    private final FetchStats stats;
    private final RetryingHttpClient client;
    private final ConcurrentPaginator paginator;
    private volatile boolean closed;
    
    private ConnectorSession(String source, Map<String, String> headers, int maxConcurrentRequests,
                             Duration timeout, Resources resources) {
        this.source = source;
        
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(source + "-fetch-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newFixedThreadPool(maxConcurrentRequests, threadFactory);
        
        Bulkhead bulkhead = Bulkhead.of(source + "-requests", BulkheadConfig.custom()
            .maxConcurrentCalls(maxConcurrentRequests)
            .maxWaitDuration(timeout)
            .build());
        
        this.stats = new FetchStats(source);
        this.client = new RetryingHttpClient(
            source,
            resources.transport(),
            resources.objectMapper(),
            headers,
            timeout,
            resources.retryPolicy(),
            bulkhead,
            stats,
            resources.sleeper(),
            resources.metricsRegistry());
        this.paginator = new ConcurrentPaginator(client, executor, maxConcurrentRequests);
        
        stats.markStarted();
    }
    
    /**
     * Open a session and stamp its start time.
     */
    public static ConnectorSession open(String source, Map<String, String> headers, int maxConcurrentRequests,
                                        Duration timeout, Resources resources) {
        return new ConnectorSession(source, headers, maxConcurrentRequests, timeout, resources);
    }
    
    public RetryingHttpClient client() {
        return client;
    }
    
    public ConcurrentPaginator paginator() {
        return paginator;
    }
    
    public FetchStats stats() {
        return stats;
    }
    
    public boolean isClosed() {
        return closed;
    }
    
    /**
     * Stop the worker pool and stamp the end time. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[{}] Workers still busy after {}s, forcing shutdown", source, SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            stats.markFinished();
        }
        log.debug("[{}] Session closed", source);
    }
    
    /**
     * Application-wide collaborators every session is built from.
     */
    public record Resources(
        HttpTransport transport,
        ObjectMapper objectMapper,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        MetricsRegistry metricsRegistry
    ) {
    }
}
