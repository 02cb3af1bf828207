package com.platform.coverage.core;

/**
 * Kinds of result a single logical HTTP request can end with.
 */
public enum OutcomeType {
    SUCCESS,          // 200 with a JSON body
    RATE_LIMITED,     // 429, honoured via Retry-After
    AUTH_FAILED,      // 401/403, never retried
    SERVER_ERROR,     // >= 500, retried with backoff
    CLIENT_ERROR,     // other non-200, never retried
    TIMEOUT,          // request deadline exceeded, retried with backoff
    TRANSPORT_ERROR   // connection or decoding failure, retried with backoff
}
