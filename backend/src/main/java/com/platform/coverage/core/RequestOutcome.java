package com.platform.coverage.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Result of one HTTP attempt or of a whole retried request.
 * Only the fields relevant to {@link #type()} are populated.
 */
public record RequestOutcome(
    OutcomeType type,
    JsonNode payload,
    Map<String, List<String>> headers,
    int statusCode,
    long retryAfterSeconds,
    String detail
) {
    
    public RequestOutcome {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }
    
    public static RequestOutcome success(JsonNode payload, Map<String, List<String>> headers) {
        return new RequestOutcome(OutcomeType.SUCCESS, payload, headers, 200, 0, null);
    }
    
    public static RequestOutcome rateLimited(long retryAfterSeconds) {
        return new RequestOutcome(OutcomeType.RATE_LIMITED, null, null, 429, retryAfterSeconds, null);
    }
    
    public static RequestOutcome authFailed(int statusCode) {
        return new RequestOutcome(OutcomeType.AUTH_FAILED, null, null, statusCode, 0, null);
    }
    
    public static RequestOutcome serverError(int statusCode) {
        return new RequestOutcome(OutcomeType.SERVER_ERROR, null, null, statusCode, 0, null);
    }
    
    public static RequestOutcome clientError(int statusCode, String body) {
        return new RequestOutcome(OutcomeType.CLIENT_ERROR, null, null, statusCode, 0, body);
    }
    
    public static RequestOutcome timeout(String detail) {
        return new RequestOutcome(OutcomeType.TIMEOUT, null, null, 0, 0, detail);
    }
    
    public static RequestOutcome transportError(String detail) {
        return new RequestOutcome(OutcomeType.TRANSPORT_ERROR, null, null, 0, 0, detail);
    }
    
    public boolean isSuccess() {
        return type == OutcomeType.SUCCESS;
    }
    
    public String header(String name) {
        return HttpResponseData.firstHeader(headers, name);
    }
    
    /**
     * Short human-readable description for log lines.
     */
    public String describe() {
        return switch (type) {
            case SUCCESS -> "success";
            case RATE_LIMITED -> "rate limited (retry after " + retryAfterSeconds + "s)";
            case AUTH_FAILED -> "authentication failed (" + statusCode + ")";
            case SERVER_ERROR -> "server error " + statusCode;
            case CLIENT_ERROR -> "client error " + statusCode;
            case TIMEOUT -> "timeout";
            case TRANSPORT_ERROR -> "transport error: " + detail;
        };
    }
}
