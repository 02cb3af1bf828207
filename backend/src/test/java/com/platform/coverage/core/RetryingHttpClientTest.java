package com.platform.coverage.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.RetryPolicy;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.observability.MetricsRegistry;
import com.platform.coverage.support.FakeTransport;
import com.platform.coverage.support.RecordingSleeper;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.platform.coverage.support.FakeTransport.json;
import static com.platform.coverage.support.FakeTransport.status;
import static org.assertj.core.api.Assertions.assertThat;

class RetryingHttpClientTest {
    
    private static final String URL = "https://pce.test:8443/api/v2/orgs/1/workloads";
    
    private RecordingSleeper sleeper;
    private FetchStats stats;
    private SimpleMeterRegistry meterRegistry;
    
    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        stats = new FetchStats("illumio");
        meterRegistry = new SimpleMeterRegistry();
    }
    
    private RetryingHttpClient client(HttpTransport transport, RetryPolicy policy) {
        return new RetryingHttpClient(
            "illumio",
            transport,
            new ObjectMapper(),
            Map.of("Accept", "application/json"),
            Duration.ofSeconds(5),
            policy,
            Bulkhead.of("test", BulkheadConfig.custom().maxConcurrentCalls(2).build()),
            stats,
            sleeper,
            new MetricsRegistry(meterRegistry));
    }
    
    @Test
    void successOnFirstAttemptReturnsPayload() {
        FakeTransport transport = FakeTransport.sequence(json("[{\"href\":\"/w/1\"}]"));
        
        RequestOutcome outcome = client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.SUCCESS);
        assertThat(outcome.payload().get(0).get("href").asText()).isEqualTo("/w/1");
        assertThat(sleeper.sleeps()).isEmpty();
        FetchStatsSnapshot snapshot = stats.snapshot();
        assertThat(snapshot.requestsMade()).isEqualTo(1);
        assertThat(snapshot.requestsSuccessful()).isEqualTo(1);
        assertThat(snapshot.requestsFailed()).isZero();
    }
    
    @Test
    void persistentServerErrorsGiveUpAfterMaxAttemptsWithExponentialSleeps() {
        FakeTransport transport = FakeTransport.sequence(status(500));
        
        RequestOutcome outcome = client(transport, new RetryPolicy(3, 1, 2, 60)).execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.SERVER_ERROR);
        assertThat(outcome.statusCode()).isEqualTo(500);
        assertThat(transport.requestCount()).isEqualTo(3);
        assertThat(sleeper.sleepSeconds()).containsExactly(1.0, 2.0);
        
        FetchStatsSnapshot snapshot = stats.snapshot();
        assertThat(snapshot.requestsMade()).isEqualTo(3);
        assertThat(snapshot.retries()).isEqualTo(3);
        assertThat(snapshot.requestsFailed()).isEqualTo(1);
        assertThat(snapshot.requestsSuccessful()).isZero();
        assertThat(meterRegistry.counter("coverage.http.requests", "source", "illumio", "outcome", "server_error").count())
            .isEqualTo(1.0);
    }
    
    @Test
    void backoffIsCappedAtMaxDelay() {
        FakeTransport transport = FakeTransport.sequence(status(503));
        
        client(transport, new RetryPolicy(5, 10, 3, 20)).execute("GET", URL, Map.of());
        
        assertThat(sleeper.sleepSeconds()).containsExactly(10.0, 20.0, 20.0, 20.0);
    }
    
    @Test
    void rateLimitWaitsForRetryAfterAndThenSucceeds() {
        FakeTransport transport = FakeTransport.sequence(
            new HttpResponseData(429, Map.of("Retry-After", List.of("7")), ""),
            json("[]"));
        
        RequestOutcome outcome = client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(sleeper.sleepSeconds()).containsExactly(7.0);
        assertThat(stats.snapshot().retries()).isEqualTo(1);
        assertThat(stats.snapshot().requestsSuccessful()).isEqualTo(1);
    }
    
    @Test
    void rateLimitDoesNotAdvanceBackoffDelay() {
        FakeTransport transport = FakeTransport.sequence(
            status(500),
            new HttpResponseData(429, Map.of("retry-after", List.of("5")), ""),
            status(502),
            json("{}"));
        
        RequestOutcome outcome = client(transport, new RetryPolicy(4, 1, 2, 60)).execute("GET", URL, Map.of());
        
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(sleeper.sleepSeconds()).containsExactly(1.0, 5.0, 2.0);
    }
    
    @Test
    void rateLimitWithoutRetryAfterWaitsDefault() {
        FakeTransport transport = FakeTransport.sequence(HttpResponseData.of(429, ""), json("[]"));
        
        client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(sleeper.sleepSeconds()).containsExactly(60.0);
    }
    
    @Test
    void authenticationFailureIsNotRetried() {
        FakeTransport transport = FakeTransport.sequence(status(401));
        
        RequestOutcome outcome = client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.AUTH_FAILED);
        assertThat(transport.requestCount()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(stats.snapshot().requestsFailed()).isEqualTo(1);
        assertThat(stats.snapshot().retries()).isZero();
    }
    
    @Test
    void forbiddenIsAnAuthenticationFailure() {
        RequestOutcome outcome = client(FakeTransport.sequence(status(403)), RetryPolicy.defaults())
            .execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.AUTH_FAILED);
        assertThat(outcome.statusCode()).isEqualTo(403);
    }
    
    @Test
    void otherClientErrorsAreNotRetried() {
        FakeTransport transport = FakeTransport.sequence(HttpResponseData.of(404, "no such table"));
        
        RequestOutcome outcome = client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.CLIENT_ERROR);
        assertThat(outcome.detail()).isEqualTo("no such table");
        assertThat(transport.requestCount()).isEqualTo(1);
    }
    
    @Test
    void non200SuccessCodeIsAClientError() {
        RequestOutcome outcome = client(FakeTransport.sequence(HttpResponseData.of(204, "")), RetryPolicy.defaults())
            .execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.CLIENT_ERROR);
    }
    
    @Test
    void timeoutIsRetriedWithBackoff() {
        AtomicInteger calls = new AtomicInteger();
        FakeTransport transport = new FakeTransport(request -> {
            if (calls.getAndIncrement() == 0) {
                throw new HttpTimeoutException("request timed out");
            }
            return json("[]");
        });
        
        RequestOutcome outcome = client(transport, RetryPolicy.defaults()).execute("GET", URL, Map.of());
        
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(transport.requestCount()).isEqualTo(2);
        assertThat(sleeper.sleepSeconds()).containsExactly(1.0);
    }
    
    @Test
    void malformedBodyIsRetriedAsTransportError() {
        FakeTransport transport = FakeTransport.sequence(json("not json {"));
        
        RequestOutcome outcome = client(transport, new RetryPolicy(2, 1, 2, 60)).execute("GET", URL, Map.of());
        
        assertThat(outcome.type()).isEqualTo(OutcomeType.TRANSPORT_ERROR);
        assertThat(transport.requestCount()).isEqualTo(2);
    }
    
    @Test
    void queryParametersAreEncoded() {
        FakeTransport transport = FakeTransport.sequence(json("{\"result\":[]}"));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sysparm_query", "companyLIKEAcme Corp^ORoperating_entityLIKEAcme");
        params.put("sysparm_limit", 10);
        
        client(transport, RetryPolicy.defaults()).execute("GET", URL, params);
        
        FakeTransport.Request request = transport.requests().get(0);
        assertThat(request.query())
            .containsEntry("sysparm_query", "companyLIKEAcme Corp^ORoperating_entityLIKEAcme")
            .containsEntry("sysparm_limit", "10");
        assertThat(request.headers()).containsEntry("Accept", "application/json");
    }
    
    @Test
    void buildUriWithoutParamsKeepsUrl() {
        assertThat(RetryingHttpClient.buildUri(URL, Map.of())).isEqualTo(URI.create(URL));
    }
    
    @Test
    void retryAfterParsing() {
        assertThat(RetryingHttpClient.parseRetryAfter(null)).isEqualTo(60);
        assertThat(RetryingHttpClient.parseRetryAfter("  ")).isEqualTo(60);
        assertThat(RetryingHttpClient.parseRetryAfter("soon")).isEqualTo(60);
        assertThat(RetryingHttpClient.parseRetryAfter("-4")).isEqualTo(60);
        assertThat(RetryingHttpClient.parseRetryAfter(" 12 ")).isEqualTo(12);
        assertThat(RetryingHttpClient.parseRetryAfter("0")).isZero();
    }
}
