package com.platform.coverage.core;

import java.time.Duration;

/**
 * Suspends the calling thread. Backoff and rate-limit waits go through here.
 */
@FunctionalInterface
public interface Sleeper {
    
    void sleep(Duration duration) throws InterruptedException;
    
    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
