package com.platform.coverage.core;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Single HTTP exchange, with no retry or classification logic.
 * Timeouts surface as {@link java.net.http.HttpTimeoutException}.
 */
@FunctionalInterface
public interface HttpTransport {
    
    HttpResponseData send(String method, URI uri, Map<String, String> headers, Duration timeout)
        throws IOException, InterruptedException;
}
