package com.platform.coverage.connectors.illumio;

import com.platform.coverage.config.CoverageProperties;
import com.platform.coverage.core.HttpResponseData;
import com.platform.coverage.model.FetchStatsSnapshot;
import com.platform.coverage.model.VenStatus;
import com.platform.coverage.model.WorkloadRecord;
import com.platform.coverage.support.FakeTransport;
import com.platform.coverage.support.RecordingSleeper;
import com.platform.coverage.support.TestResources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class IllumioConnectorTest {
    
    private static final String LABELS = """
        [
          {"href": "/orgs/1/labels/1", "key": "app", "value": "Payments"},
          {"href": "/orgs/1/labels/2", "key": "env", "value": "Production"},
          {"href": "/orgs/1/labels/3", "key": "bu", "value": "Retail"},
          {"href": "/orgs/1/labels/4", "key": "role", "value": "Web"}
        ]
        """;
    
    private static final List<String> WORKLOADS = List.of(
        """
        {"href": "/orgs/1/workloads/w1", "name": "web01", "hostname": "web01.corp.example.com",
         "managed": true, "online": true, "enforcement_mode": "full", "visibility_level": "flow_summary",
         "labels": [{"href": "/orgs/1/labels/1"}, {"href": "/orgs/1/labels/2"},
                    {"href": "/orgs/1/labels/3"}, {"href": "/orgs/1/labels/4"}, {"href": "/orgs/1/labels/99"}],
         "interfaces": [{"name": "lo"}, {"address": "10.0.0.1"}, {"address": "10.0.0.2"}],
         "agent": {"href": "/orgs/1/agents/a1",
                   "status": {"status": "Active", "agent_version": "21.5.1", "last_heartbeat_on": "2024-05-01T10:00:00Z"},
                   "config": {"mode": "illuminated", "visibility_level": "flow_summary", "log_traffic": true}},
         "caps": ["write", "delete"], "firewall_coexistence": {"illumio_primary": true},
         "created_by": {"href": "/users/7"}, "os_type": "linux"}
        """,
        """
        {"href": "/orgs/1/workloads/w2", "hostname": "web02", "managed": false, "online": false,
         "agent": null, "interfaces": []}
        """,
        """
        {"href": "/orgs/1/workloads/w3", "hostname": "db01.corp", "managed": true, "online": false,
         "agent": {"status": {}}}
        """,
        """
        {"href": "/orgs/1/workloads/w4", "hostname": "app01", "managed": true, "online": true,
         "agent": {"status": {"status": "SUSPENDED"}}}
        """,
        """
        {"href": "/orgs/1/workloads/w5", "hostname": null, "managed": true, "online": true}
        """);
    
    private FakeTransport transport;
    private CoverageProperties.Illumio config;
    
    @BeforeEach
    void setUp() {
        config = new CoverageProperties.Illumio();
        config.setPceUrl("https://pce.test/");
        config.setPort(8443);
        config.setOrgId("1");
        config.setApiUser("api_user");
        config.setApiSecret("s3cret");
        config.setPageSize(2);
        config.setMaxConcurrentRequests(2);
        
        transport = new FakeTransport(request -> {
            String path = request.path();
            if (path.endsWith("/labels")) {
                return request.intParam("offset") == 0 ? FakeTransport.json(LABELS) : FakeTransport.json("[]");
            }
            if (path.endsWith("/workloads")) {
                int offset = request.intParam("offset");
                int limit = request.intParam("max_results");
                String page = WORKLOADS.stream()
                    .skip(offset)
                    .limit(limit)
                    .collect(Collectors.joining(",", "[", "]"));
                return FakeTransport.json(page);
            }
            if (path.endsWith("/health")) {
                return FakeTransport.json("[{\"status\": \"normal\"}]");
            }
            return HttpResponseData.of(404, "");
        });
    }
    
    private IllumioConnector connector() {
        return new IllumioConnector(config, true, TestResources.of(transport, new RecordingSleeper()));
    }
    
    @Test
    void testConnectionRequestsSingleWorkloadWithBasicAuth() {
        try (IllumioConnector connector = connector()) {
            assertThat(connector.testConnection()).isTrue();
        }
        
        FakeTransport.Request request = transport.requests().get(0);
        assertThat(request.uri().toString()).startsWith("https://pce.test:8443/api/v2/orgs/1/workloads");
        assertThat(request.query()).containsEntry("max_results", "1");
        String expected = Base64.getEncoder().encodeToString("api_user:s3cret".getBytes(StandardCharsets.UTF_8));
        assertThat(request.headers())
            .containsEntry("Authorization", "Basic " + expected)
            .containsEntry("Accept", "application/json");
    }
    
    @Test
    void testConnectionFailsOnAuthError() {
        transport = FakeTransport.sequence(FakeTransport.status(401));
        
        try (IllumioConnector connector = connector()) {
            assertThat(connector.testConnection()).isFalse();
        }
        assertThat(transport.requestCount()).isEqualTo(1);
    }
    
    @Test
    void fetchAllEnrichesWorkloads() {
        List<WorkloadRecord> workloads;
        try (IllumioConnector connector = connector()) {
            workloads = connector.fetchAll();
        }
        
        assertThat(workloads).hasSize(5);
        Map<String, WorkloadRecord> byHref = workloads.stream()
            .collect(Collectors.toMap(WorkloadRecord::getHref, Function.identity()));
        
        WorkloadRecord web01 = byHref.get("/orgs/1/workloads/w1");
        assertThat(web01.getHostnameNormalized()).isEqualTo("WEB01");
        assertThat(web01.getPrimaryIp()).isEqualTo("10.0.0.1");
        assertThat(web01.getAllIps()).isEqualTo("10.0.0.1, 10.0.0.2");
        assertThat(web01.getInterfacesCount()).isEqualTo(3);
        assertThat(web01.getLabelApp()).isEqualTo("Payments");
        assertThat(web01.getLabelEnv()).isEqualTo("Production");
        assertThat(web01.getLabelRole()).isEqualTo("Web");
        assertThat(web01.getLabelLoc()).isEmpty();
        assertThat(web01.getExtraLabels()).containsExactly(Map.entry("label_bu", "Retail"));
        assertThat(web01.getVenVersion()).isEqualTo("21.5.1");
        assertThat(web01.getVenStatusLabel()).isEqualTo("active");
        assertThat(web01.getVenStatus()).isEqualTo(VenStatus.ACTIVE);
        assertThat(web01.getAgentMode()).isEqualTo("illuminated");
        assertThat(web01.isAgentLogTraffic()).isTrue();
        assertThat(web01.getCaps()).isEqualTo("write, delete");
        assertThat(web01.getFirewallCoexistence()).isTrue();
        assertThat(web01.getContainersInheritHostPolicy()).isNull();
        assertThat(web01.getCreatedBy()).isEqualTo("/users/7");
        
        assertThat(byHref.get("/orgs/1/workloads/w2").getVenStatus()).isEqualTo(VenStatus.UNMANAGED);
        assertThat(byHref.get("/orgs/1/workloads/w2").getPrimaryIp()).isEmpty();
        assertThat(byHref.get("/orgs/1/workloads/w3").getVenStatusLabel()).isEqualTo("offline");
        assertThat(byHref.get("/orgs/1/workloads/w3").getHostnameNormalized()).isEqualTo("DB01");
        assertThat(byHref.get("/orgs/1/workloads/w4").getVenStatus()).isEqualTo(VenStatus.SUSPENDED);
        assertThat(byHref.get("/orgs/1/workloads/w5").hasHostname()).isFalse();
    }
    
    @Test
    void fetchLabelsBuildsHrefLookup() {
        Map<String, WorkloadEnricher.Label> labels;
        try (IllumioConnector connector = connector()) {
            labels = connector.fetchLabels();
        }
        
        assertThat(labels).hasSize(4);
        assertThat(labels.get("/orgs/1/labels/3")).isEqualTo(new WorkloadEnricher.Label("bu", "Retail"));
    }
    
    @Test
    void fetchHealthReturnsDocumentOrEmpty() {
        try (IllumioConnector connector = connector()) {
            assertThat(connector.fetchHealth()).isPresent();
        }
        
        transport = FakeTransport.sequence(HttpResponseData.of(404, ""));
        try (IllumioConnector connector = connector()) {
            assertThat(connector.fetchHealth()).isEmpty();
        }
    }
    
    @Test
    void closeStampsSessionEnd() {
        IllumioConnector connector = connector();
        connector.testConnection();
        connector.close();
        connector.close();
        
        FetchStatsSnapshot stats = connector.stats();
        assertThat(stats.source()).isEqualTo("illumio");
        assertThat(stats.requestsMade()).isEqualTo(1);
        assertThat(stats.startTime()).isNotNull();
        assertThat(stats.endTime()).isNotNull();
        assertThat(stats.durationSeconds()).isNotNull();
    }
    
    @Test
    void lowerCaseKeysWhenConfigured() {
        List<WorkloadRecord> workloads;
        try (IllumioConnector connector = new IllumioConnector(config, false,
                TestResources.of(transport, new RecordingSleeper()))) {
            workloads = connector.fetchAll();
        }
        
        assertThat(workloads).extracting(WorkloadRecord::getHostnameNormalized).contains("web01", "db01");
    }
}
