package com.platform.coverage.config;

import java.time.Duration;

/**
 * Retry policy for one logical HTTP request.
 * Delays are expressed in seconds to match the configuration file.
 */
public record RetryPolicy(
    int maxAttempts,
    double initialDelaySeconds,
    double backoffMultiplier,
    double maxDelaySeconds
) {
    
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelaySeconds < 0 || maxDelaySeconds < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }
    
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1, 2, 60);
    }
    
    /**
     * Next delay in the exponential schedule, capped at the maximum.
     */
    public double nextDelay(double currentDelaySeconds) {
        return Math.min(currentDelaySeconds * backoffMultiplier, maxDelaySeconds);
    }
    
    public static Duration toDuration(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
