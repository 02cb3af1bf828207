package com.platform.coverage.core;

import java.util.List;
import java.util.Map;

/**
 * Raw HTTP response as seen by the retrying client.
 */
public record HttpResponseData(
    int statusCode,
    Map<String, List<String>> headers,
    String body
) {
    
    public HttpResponseData {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : "";
    }
    
    public static HttpResponseData of(int statusCode, String body) {
        return new HttpResponseData(statusCode, Map.of(), body);
    }
    
    /**
     * First value of a header, matched case-insensitively.
     */
    public String header(String name) {
        return firstHeader(headers, name);
    }
    
    static String firstHeader(Map<String, List<String>> headers, String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
