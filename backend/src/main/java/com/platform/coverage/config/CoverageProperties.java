package com.platform.coverage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the coverage audit run.
 * Secrets are expected to arrive through environment placeholders in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "coverage")
public class CoverageProperties {
    
    private static final String URL_PATTERN = "^https?://.*";
    
    /**
     * Whether the audit runs once the application context is ready.
     */
    private boolean runOnStartup = true;
    
    @Valid
    private Illumio illumio = new Illumio();
    
    @Valid
    private ServiceNow servicenow = new ServiceNow();
    
    @Valid
    private Retry retry = new Retry();
    
    private Filtering filtering = new Filtering();
    
    private Normalization normalization = new Normalization();
    
    private Output output = new Output();
    
    /**
     * Illumio PCE connection settings.
     */
    @Data
    public static class Illumio {
        
        @Pattern(regexp = URL_PATTERN, message = "PCE URL must start with http:// or https://")
        private String pceUrl = "https://pce.example.com";
        
        private int port = 8443;
        
        private String orgId = "1";
        
        private String apiUser;
        
        private String apiSecret;
        
        @Min(1)
        private int pageSize = 500;
        
        @Min(1)
        private int maxConcurrentRequests = 15;
        
        @Min(1)
        private int timeoutSeconds = 30;
        
        public void setPceUrl(String pceUrl) {
            this.pceUrl = stripTrailingSlash(pceUrl);
        }
        
        /**
         * Organisation-scoped API root.
         */
        public String getBaseUrl() {
            return String.format("%s:%d/api/v2/orgs/%s", pceUrl, port, orgId);
        }
        
        public Duration getTimeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
    
    /**
     * ServiceNow CMDB connection settings.
     */
    @Data
    public static class ServiceNow {
        
        /**
         * When false the run is Illumio-only.
         */
        private boolean enabled = true;
        
        @Pattern(regexp = URL_PATTERN, message = "Instance URL must start with http:// or https://")
        private String instanceUrl = "https://instance.service-now.com";
        
        private String apiUser;
        
        private String apiKey;
        
        private String table = "cmdb_ci_server";
        
        @Min(1)
        private int pageSize = 10000;
        
        @Min(1)
        private int maxConcurrentRequests = 10;
        
        @Min(1)
        private int timeoutSeconds = 60;
        
        public void setInstanceUrl(String instanceUrl) {
            this.instanceUrl = stripTrailingSlash(instanceUrl);
        }
        
        public String getBaseUrl() {
            return instanceUrl + "/api/now/table";
        }
        
        public Duration getTimeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
    
    /**
     * Retry policy shared by both connectors.
     */
    @Data
    public static class Retry {
        
        @Min(1)
        private int maxAttempts = 3;
        
        @DecimalMin("0.0")
        private double initialDelaySeconds = 1;
        
        @DecimalMin("1.0")
        private double backoffMultiplier = 2;
        
        @DecimalMin("0.0")
        private double maxDelaySeconds = 60;
        
        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialDelaySeconds, backoffMultiplier, maxDelaySeconds);
        }
    }
    
    @Data
    public static class Filtering {
        
        /**
         * Substring matched against the CMDB operating entity fields. Blank disables the filter.
         */
        private String operatingEntityContains;
    }
    
    @Data
    public static class Normalization {
        
        private boolean hostnameUppercase = true;
    }
    
    @Data
    public static class Output {
        
        private String basePath = "./outputs";
        
        private String extractsFolder = "extracts";
        
        private boolean createDateSubfolder = true;
        
        private String filePrefix = "illumio_monitoring";
    }
    
    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
