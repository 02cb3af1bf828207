package com.platform.coverage.core;

import com.platform.coverage.model.FetchStatsSnapshot;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request counters for one connector session.
 * Page fetches run concurrently, so every counter is atomic.
 */
public class FetchStats {
    
    private final String source;
    private final AtomicLong requestsMade = new AtomicLong();
    private final AtomicLong requestsSuccessful = new AtomicLong();
    private final AtomicLong requestsFailed = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicReference<Instant> startTime = new AtomicReference<>();
    private final AtomicReference<Instant> endTime = new AtomicReference<>();
    
    public FetchStats(String source) {
        this.source = source;
    }
    
    public void markStarted() {
        startTime.compareAndSet(null, Instant.now());
    }
    
    public void markFinished() {
        endTime.compareAndSet(null, Instant.now());
    }
    
    public void recordRequest() {
        requestsMade.incrementAndGet();
    }
    
    public void recordSuccess() {
        requestsSuccessful.incrementAndGet();
    }
    
    public void recordFailure() {
        requestsFailed.incrementAndGet();
    }
    
    public void recordRetry() {
        retries.incrementAndGet();
    }
    
    public FetchStatsSnapshot snapshot() {
        return FetchStatsSnapshot.of(
            source,
            requestsMade.get(),
            requestsSuccessful.get(),
            requestsFailed.get(),
            retries.get(),
            startTime.get(),
            endTime.get()
        );
    }
}
