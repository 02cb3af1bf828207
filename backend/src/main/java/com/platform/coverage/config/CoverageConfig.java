package com.platform.coverage.config;

import com.platform.coverage.core.HttpTransport;
import com.platform.coverage.core.JdkHttpTransport;
import com.platform.coverage.core.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wiring for the HTTP layer shared by both inventory connectors.
 */
@Configuration
@EnableConfigurationProperties(CoverageProperties.class)
public class CoverageConfig {

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Bean
    public HttpTransport httpTransport(HttpClient httpClient) {
        return new JdkHttpTransport(httpClient);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
