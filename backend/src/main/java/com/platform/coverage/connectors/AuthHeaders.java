package com.platform.coverage.connectors;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request header sets for JSON APIs.
 */
public final class AuthHeaders {
    
    private AuthHeaders() {
    }
    
    public static Map<String, String> basic(String user, String secret) {
        String credentials = nz(user) + ":" + nz(secret);
        String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return json("Basic " + encoded);
    }
    
    public static Map<String, String> bearer(String token) {
        return json("Bearer " + nz(token));
    }
    
    private static Map<String, String> json(String authorization) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", authorization);
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        return headers;
    }
    
    private static String nz(String value) {
        return value != null ? value : "";
    }
}
