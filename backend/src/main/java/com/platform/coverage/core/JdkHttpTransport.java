package com.platform.coverage.core;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} backed by the JDK HTTP client.
 */
public class JdkHttpTransport implements HttpTransport {
    
    private final HttpClient httpClient;
    
    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }
    
    @Override
    public HttpResponseData send(String method, URI uri, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .method(method, HttpRequest.BodyPublishers.noBody());
        headers.forEach(builder::header);
        
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new HttpResponseData(response.statusCode(), response.headers().map(), response.body());
    }
}
