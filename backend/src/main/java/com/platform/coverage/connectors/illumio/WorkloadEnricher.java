package com.platform.coverage.connectors.illumio;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.coverage.model.VenStatus;
import com.platform.coverage.model.WorkloadRecord;
import com.platform.coverage.normalization.HostnameNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a raw PCE workload into a {@link WorkloadRecord}: resolves label references,
 * flattens interfaces and agent details, derives the VEN status.
 */
public class WorkloadEnricher {
    
    private static final Set<String> STANDARD_LABEL_KEYS = Set.of("role", "app", "env", "loc");
    
    private final Map<String, Label> labelsByHref;
    private final boolean hostnameUppercase;
    
    public WorkloadEnricher(Map<String, Label> labelsByHref, boolean hostnameUppercase) {
        this.labelsByHref = Map.copyOf(labelsByHref);
        this.hostnameUppercase = hostnameUppercase;
    }
    
    public WorkloadRecord enrich(JsonNode workload) {
        Map<String, String> labels = resolveLabels(workload.path("labels"));
        
        List<String> ips = new ArrayList<>();
        for (JsonNode iface : workload.path("interfaces")) {
            String address = text(iface, "address");
            if (!address.isEmpty()) {
                ips.add(address);
            }
        }
        
        JsonNode agent = workload.path("agent");
        JsonNode agentConfig = agent.path("config");
        JsonNode agentStatus = agent.path("status");
        
        boolean online = workload.path("online").asBoolean(false);
        boolean managed = workload.path("managed").asBoolean(false);
        String reportedStatus = text(agentStatus, "status");
        String venLabel = venStatusLabel(managed, online, reportedStatus);
        String hostname = text(workload, "hostname");
        
        WorkloadRecord.WorkloadRecordBuilder builder = WorkloadRecord.builder()
            .href(text(workload, "href"))
            .name(text(workload, "name"))
            .hostname(hostname)
            .hostnameNormalized(HostnameNormalizer.normalize(hostname, hostnameUppercase))
            .description(text(workload, "description"))
            .distinguishedName(text(workload, "distinguished_name"))
            .primaryIp(ips.isEmpty() ? "" : ips.get(0))
            .allIps(String.join(", ", ips))
            .publicIp(text(workload, "public_ip"))
            .interfacesCount(workload.path("interfaces").size())
            .online(online)
            .managed(managed)
            .enforcementMode(text(workload, "enforcement_mode"))
            .visibilityLevel(text(workload, "visibility_level"))
            .agentHref(text(agent, "href"))
            .agentStatus(reportedStatus)
            .agentLastHeartbeat(text(agentStatus, "last_heartbeat_on"))
            .agentMode(text(agentConfig, "mode"))
            .agentVisibilityLevel(text(agentConfig, "visibility_level"))
            .agentLogTraffic(agentConfig.path("log_traffic").asBoolean(false))
            .venVersion(text(agentStatus, "agent_version"))
            .venStatus(VenStatus.fromAgentValue(venLabel))
            .venStatusLabel(venLabel)
            .osType(text(workload, "os_type"))
            .osId(text(workload, "os_id"))
            .osDetail(text(workload, "os_detail"))
            .servicePrincipalName(text(workload, "service_principal_name"))
            .dataCenter(text(workload, "data_center"))
            .dataCenterZone(text(workload, "data_center_zone"))
            .firewallCoexistence(optionalBoolean(workload.path("firewall_coexistence").path("illumio_primary")))
            .containersInheritHostPolicy(optionalBoolean(workload.path("containers_inherit_host_policy")))
            .blockedConnectionAction(text(workload, "blocked_connection_action"))
            .vulnerabilityExposureScore(text(workload, "vulnerability_exposure_score"))
            .createdAt(text(workload, "created_at"))
            .updatedAt(text(workload, "updated_at"))
            .createdBy(text(workload.path("created_by"), "href"))
            .deleted(workload.path("deleted").asBoolean(false))
            .deleteType(text(workload, "delete_type"))
            .caps(joinTexts(workload.path("caps")))
            .labelRole(labels.getOrDefault("role", ""))
            .labelApp(labels.getOrDefault("app", ""))
            .labelEnv(labels.getOrDefault("env", ""))
            .labelLoc(labels.getOrDefault("loc", ""));
        
        labels.forEach((key, value) -> {
            if (!STANDARD_LABEL_KEYS.contains(key)) {
                builder.extraLabel("label_" + key, value);
            }
        });
        
        return builder.build();
    }
    
    /**
     * unmanaged, else the agent-reported status lower-cased, else active/offline from the online flag.
     */
    static String venStatusLabel(boolean managed, boolean online, String reportedStatus) {
        if (!managed) {
            return VenStatus.UNMANAGED.getValue();
        }
        if (reportedStatus != null && !reportedStatus.isEmpty()) {
            return reportedStatus.toLowerCase(Locale.ROOT);
        }
        return online ? VenStatus.ACTIVE.getValue() : VenStatus.OFFLINE.getValue();
    }
    
    private Map<String, String> resolveLabels(JsonNode references) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (JsonNode reference : references) {
            Label label = labelsByHref.get(text(reference, "href"));
            if (label != null) {
                resolved.put(label.key(), label.value());
            }
        }
        return resolved;
    }
    
    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText();
    }
    
    private static Boolean optionalBoolean(JsonNode node) {
        return node.isBoolean() ? node.booleanValue() : null;
    }
    
    private static String joinTexts(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return String.join(", ", values);
    }
    
    /**
     * A PCE label: {@code key} is the dimension (role, app, env, loc or custom).
     */
    public record Label(String key, String value) {
    }
}
