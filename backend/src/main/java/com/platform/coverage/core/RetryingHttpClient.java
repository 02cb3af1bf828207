package com.platform.coverage.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.RetryPolicy;
import com.platform.coverage.observability.MetricsRegistry;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Issues one logical request with bounded retries and exponential backoff.
 *
 * Policy per response:
 * - 200: success
 * - 429: wait for Retry-After (60s by default) and retry; the backoff delay is left untouched
 * - 401/403: authentication failure, never retried
 * - >= 500, timeouts and transport errors: retried with backoff
 * - anything else: client error, never retried
 *
 * All in-flight requests of one connector share the bulkhead passed in.
 */
@Slf4j
public class RetryingHttpClient {

    static final long DEFAULT_RETRY_AFTER_SECONDS = 60;
    private static final int LOGGED_BODY_LIMIT = 200;

    private final String source;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Bulkhead bulkhead;
    private final FetchStats stats;
    private final Sleeper sleeper;
    private final MetricsRegistry metricsRegistry;

    public RetryingHttpClient(
            String source,
            HttpTransport transport,
            ObjectMapper objectMapper,
            Map<String, String> headers,
            Duration timeout,
            RetryPolicy retryPolicy,
            Bulkhead bulkhead,
            FetchStats stats,
            Sleeper sleeper,
            MetricsRegistry metricsRegistry) {
        this.source = source;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.headers = Map.copyOf(headers);
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.bulkhead = bulkhead;
        this.stats = stats;
        this.sleeper = sleeper;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Execute a request, retrying according to the policy.
     * Never throws for HTTP or network failures; the returned outcome says what happened.
     */
    public RequestOutcome execute(String method, String url, Map<String, ?> queryParams) {
        URI uri = buildUri(url, queryParams);
        int maxAttempts = retryPolicy.maxAttempts();
        double delaySeconds = retryPolicy.initialDelaySeconds();
        RequestOutcome last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            RequestOutcome outcome = attemptOnce(method, uri);
            last = outcome;

            Disposition disposition = switch (outcome.type()) {
                case SUCCESS -> Disposition.DONE;
                case AUTH_FAILED, CLIENT_ERROR -> Disposition.GIVE_UP;
                case RATE_LIMITED -> Disposition.WAIT_RETRY_AFTER;
                case SERVER_ERROR, TIMEOUT, TRANSPORT_ERROR -> Disposition.BACKOFF;
            };

            switch (disposition) {
                case DONE -> {
                    stats.recordSuccess();
                    metricsRegistry.recordRequestOutcome(source, outcome.type());
                    if (attempt > 1) {
                        log.info("[{}] {} succeeded after {} attempts", source, uri.getPath(), attempt);
                    }
                    return outcome;
                }
                case GIVE_UP -> {
                    logTerminalFailure(outcome);
                    stats.recordFailure();
                    metricsRegistry.recordRequestOutcome(source, outcome.type());
                    return outcome;
                }
                case WAIT_RETRY_AFTER -> {
                    log.warn("[{}] Rate limited. Waiting {}s before retry.", source, outcome.retryAfterSeconds());
                    stats.recordRetry();
                    metricsRegistry.recordRateLimited(source);
                    if (attempt < maxAttempts && !pause(Duration.ofSeconds(outcome.retryAfterSeconds()))) {
                        return giveUp(uri, outcome);
                    }
                }
                case BACKOFF -> {
                    log.warn("[{}] {}. Attempt {}/{}", source, outcome.describe(), attempt, maxAttempts);
                    stats.recordRetry();
                    metricsRegistry.recordRetryAttempt(source, attempt);
                    if (attempt < maxAttempts) {
                        if (!pause(RetryPolicy.toDuration(delaySeconds))) {
                            return giveUp(uri, outcome);
                        }
                        delaySeconds = retryPolicy.nextDelay(delaySeconds);
                    }
                }
            }
        }

        log.error("[{}] All {} retry attempts failed for {}", source, maxAttempts, uri);
        return giveUp(uri, last);
    }

    private RequestOutcome attemptOnce(String method, URI uri) {
        try {
            bulkhead.acquirePermission();
        } catch (BulkheadFullException e) {
            return RequestOutcome.transportError("admission gate saturated: " + e.getMessage());
        }

        try {
            stats.recordRequest();
            HttpResponseData response = transport.send(method, uri, headers, timeout);
            return classify(response);
        } catch (HttpTimeoutException e) {
            return RequestOutcome.timeout(e.getMessage());
        } catch (IOException e) {
            return RequestOutcome.transportError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RequestOutcome.transportError("interrupted");
        } finally {
            bulkhead.onComplete();
        }
    }

    private RequestOutcome classify(HttpResponseData response) {
        int status = response.statusCode();

        if (status == 200) {
            try {
                JsonNode payload = objectMapper.readTree(response.body());
                return RequestOutcome.success(payload, response.headers());
            } catch (JsonProcessingException e) {
                return RequestOutcome.transportError("invalid JSON body: " + e.getOriginalMessage());
            }
        }
        if (status == 429) {
            return RequestOutcome.rateLimited(parseRetryAfter(response.header("Retry-After")));
        }
        if (status == 401 || status == 403) {
            return RequestOutcome.authFailed(status);
        }
        if (status >= 500) {
            return RequestOutcome.serverError(status);
        }
        return RequestOutcome.clientError(status, response.body());
    }

    static long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? seconds : DEFAULT_RETRY_AFTER_SECONDS;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private void logTerminalFailure(RequestOutcome outcome) {
        if (outcome.type() == OutcomeType.AUTH_FAILED) {
            log.error("[{}] Authentication failed: {}", source, outcome.statusCode());
        } else {
            String body = outcome.detail() != null ? outcome.detail() : "";
            if (body.length() > LOGGED_BODY_LIMIT) {
                body = body.substring(0, LOGGED_BODY_LIMIT);
            }
            log.error("[{}] Request failed: {} - {}", source, outcome.statusCode(), body);
        }
    }

    private RequestOutcome giveUp(URI uri, RequestOutcome last) {
        stats.recordFailure();
        metricsRegistry.recordRequestOutcome(source, last.type());
        log.debug("[{}] Giving up on {} with {}", source, uri, last.describe());
        return last;
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Retry wait interrupted", source);
            return false;
        }
    }

    static URI buildUri(String url, Map<String, ?> queryParams) {
        if (queryParams == null || queryParams.isEmpty()) {
            return URI.create(url);
        }
        String query = queryParams.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
            .collect(Collectors.joining("&"));
        return URI.create(url + (url.contains("?") ? "&" : "?") + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public String getSource() {
        return source;
    }

    private enum Disposition {
        DONE,
        GIVE_UP,
        WAIT_RETRY_AFTER,
        BACKOFF
    }
}
