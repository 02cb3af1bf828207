package com.platform.coverage.connectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.connectors.illumio.IllumioConnector;
import com.platform.coverage.connectors.servicenow.ServiceNowConnector;
import com.platform.coverage.error.ConfigurationException;
import com.platform.coverage.observability.MetricsRegistry;
import com.platform.coverage.support.FakeTransport;
import com.platform.coverage.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorFactoryTest {
    
    private CoverageProperties properties;
    private ConnectorFactory factory;
    
    @BeforeEach
    void setUp() {
        properties = new CoverageProperties();
        factory = new ConnectorFactory(
            properties,
            FakeTransport.sequence(FakeTransport.json("[]")),
            new ObjectMapper(),
            new RecordingSleeper(),
            new MetricsRegistry(new SimpleMeterRegistry()));
    }
    
    @Test
    void missingPceCredentialsAreAConfigurationError() {
        assertThatThrownBy(() -> factory.illumio())
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).getProperty()).isEqualTo("coverage.illumio.api-user"));
    }
    
    @Test
    void missingCmdbKeyIsAConfigurationError() {
        properties.getServicenow().setApiUser("svc");
        
        assertThatThrownBy(() -> factory.servicenow())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("coverage.servicenow.api-key");
    }
    
    @Test
    void opensIndependentSessions() {
        properties.getIllumio().setApiUser("u");
        properties.getIllumio().setApiSecret("s");
        properties.getServicenow().setApiUser("u");
        properties.getServicenow().setApiKey("k");
        
        try (IllumioConnector first = factory.illumio();
             IllumioConnector second = factory.illumio();
             ServiceNowConnector cmdb = factory.servicenow()) {
            first.testConnection();
            
            assertThat(first.stats().requestsMade()).isEqualTo(1);
            assertThat(second.stats().requestsMade()).isZero();
            assertThat(cmdb.sourceName()).isEqualTo("servicenow");
        }
        assertThat(factory.isServiceNowEnabled()).isTrue();
    }
}
