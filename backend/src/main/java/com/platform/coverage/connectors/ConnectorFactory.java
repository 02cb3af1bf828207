package com.platform.coverage.connectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.connectors.illumio.IllumioConnector;
import com.platform.coverage.connectors.servicenow.ServiceNowConnector;
import com.platform.coverage.core.HttpTransport;
import com.platform.coverage.core.Sleeper;
import com.platform.coverage.error.ConfigurationException;
import com.platform.coverage.observability.MetricsRegistry;
import org.springframework.stereotype.Component;

/**
 * Opens connector sessions from the bound configuration. Every call returns a fresh session
 * the caller must close.
 */
@Component
public class ConnectorFactory {
    
    private final CoverageProperties properties;
    private final ConnectorSession.Resources resources;
    
    public ConnectorFactory(
            CoverageProperties properties,
            HttpTransport transport,
            ObjectMapper objectMapper,
            Sleeper sleeper,
            MetricsRegistry metricsRegistry) {
        this.properties = properties;
        this.resources = new ConnectorSession.Resources(
            transport,
            objectMapper,
            properties.getRetry().toPolicy(),
            sleeper,
            metricsRegistry);
    }
    
    /**
     * @throws ConfigurationException when the PCE credentials are missing
     */
    public IllumioConnector illumio() {
        CoverageProperties.Illumio illumio = properties.getIllumio();
        requireValue("coverage.illumio.api-user", illumio.getApiUser());
        requireValue("coverage.illumio.api-secret", illumio.getApiSecret());
        return new IllumioConnector(
            illumio,
            properties.getNormalization().isHostnameUppercase(),
            resources);
    }
    
    /**
     * @throws ConfigurationException when the CMDB credentials are missing
     */
    public ServiceNowConnector servicenow() {
        CoverageProperties.ServiceNow servicenow = properties.getServicenow();
        requireValue("coverage.servicenow.api-user", servicenow.getApiUser());
        requireValue("coverage.servicenow.api-key", servicenow.getApiKey());
        return new ServiceNowConnector(
            servicenow,
            properties.getFiltering().getOperatingEntityContains(),
            properties.getNormalization().isHostnameUppercase(),
            resources);
    }
    
    public boolean isServiceNowEnabled() {
        return properties.getServicenow().isEnabled();
    }
    
    private static void requireValue(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(property, property + " is not set");
        }
    }
}
