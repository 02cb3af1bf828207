package com.platform.coverage.observability;

import com.platform.coverage.core.OutcomeType;
import com.platform.coverage.model.ReconciliationStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Central registry for audit run metrics.
 * Covers HTTP request outcomes per source, fetch latencies and the coverage rates of the last run.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicLong> recordCounts;
    private final Map<String, AtomicReference<Double>> rates;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.recordCounts = new ConcurrentHashMap<>();
        this.rates = new ConcurrentHashMap<>();
        
        initializeMetrics();
    }
    
    private void initializeMetrics() {
        for (String source : new String[]{"illumio", "servicenow"}) {
            Gauge.builder("coverage.source.records", () -> recordCount(source).get())
                .tag("source", source)
                .register(meterRegistry);
        }
        
        for (String rate : new String[]{"coverage", "active", "enforcement"}) {
            Gauge.builder("coverage.rate.percent", () -> rate(rate).get())
                .tag("rate", rate)
                .register(meterRegistry);
        }
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record the final outcome of one logical request.
     */
    public void recordRequestOutcome(String source, OutcomeType outcome) {
        incrementCounter("coverage.http.requests", "source", source, "outcome", outcome.name().toLowerCase(Locale.ROOT));
    }
    
    /**
     * Record retry attempt.
     */
    public void recordRetryAttempt(String source, int attemptNumber) {
        getCounter("coverage.http.retry", source).increment();
        log.debug("Recorded retry attempt {} for {}", attemptNumber, source);
    }
    
    public void recordRateLimited(String source) {
        getCounter("coverage.http.rate_limited", source).increment();
    }
    
    /**
     * Record latency for a fetch phase.
     */
    public void recordLatency(String source, String operation, long latencyMs) {
        String timerKey = source + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("coverage.operation.latency")
                .tag("source", source)
                .tag("operation", operation)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    public void recordRecordsFetched(String source, long count) {
        recordCount(source).set(count);
    }
    
    /**
     * Publish the rates of a finished reconciliation.
     */
    public void recordReconciliation(ReconciliationStats stats) {
        rate("coverage").set(stats.coverageRate());
        rate("active").set(stats.activeRate());
        rate("enforcement").set(stats.enforcementRate());
        incrementCounter("coverage.reconciliation.runs");
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    public long getRecordsFetched(String source) {
        AtomicLong count = recordCounts.get(source);
        return count != null ? count.get() : -1;
    }
    
    private Counter getCounter(String name, String source) {
        String key = name + "." + source;
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tag("source", source)
                .register(meterRegistry));
    }
    
    private AtomicLong recordCount(String source) {
        return recordCounts.computeIfAbsent(source, k -> new AtomicLong(0));
    }
    
    private AtomicReference<Double> rate(String name) {
        return rates.computeIfAbsent(name, k -> new AtomicReference<>(0.0));
    }
}
