package com.platform.coverage.connectors.servicenow;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.coverage.model.ServerRecord;
import com.platform.coverage.normalization.HostnameNormalizer;

import java.util.Iterator;
import java.util.Map;

/**
 * Flattens a raw CMDB row into a {@link ServerRecord}.
 *
 * Reference fields arrive either as scalars or as {@code {value, display_value, link}} objects,
 * depending on {@code sysparm_display_value}. Both shapes are read through {@link #displayValue}.
 */
public class ServerNormalizer {
    
    private static final String CUSTOM_FIELD_PREFIX = "u_";
    
    private final boolean hostnameUppercase;
    
    public ServerNormalizer(boolean hostnameUppercase) {
        this.hostnameUppercase = hostnameUppercase;
    }
    
    public ServerRecord normalize(JsonNode server) {
        String hostname = firstNonEmpty(text(server, "name"), text(server, "host_name"));
        
        ServerRecord.ServerRecordBuilder builder = ServerRecord.builder()
            .sysId(text(server, "sys_id"))
            .name(text(server, "name"))
            .hostname(hostname)
            .hostnameNormalized(HostnameNormalizer.normalize(hostname, hostnameUppercase))
            .assetTag(text(server, "asset_tag"))
            .serialNumber(text(server, "serial_number"))
            .fqdn(text(server, "fqdn"))
            .dnsDomain(text(server, "dns_domain"))
            .ipAddress(text(server, "ip_address"))
            .macAddress(text(server, "mac_address"))
            .sysClassName(text(server, "sys_class_name"))
            .category(text(server, "category"))
            .subcategory(text(server, "subcategory"))
            .classification(text(server, "classification"))
            .operatingEntity(displayValue(server.has("u_operating_entity")
                ? server.get("u_operating_entity") : server.get("operating_entity")))
            .company(displayValue(server.get("company")))
            .department(displayValue(server.get("department")))
            .location(displayValue(server.get("location")))
            .costCenter(text(server, "cost_center"))
            .businessUnit(text(server, "business_unit"))
            .os(text(server, "os"))
            .osVersion(text(server, "os_version"))
            .osDomain(text(server, "os_domain"))
            .cpuCount(text(server, "cpu_count"))
            .cpuType(text(server, "cpu_type"))
            .cpuSpeed(text(server, "cpu_speed"))
            .ram(text(server, "ram"))
            .diskSpace(text(server, "disk_space"))
            .virtual(text(server, "virtual"))
            .operationalStatus(displayValue(server.get("operational_status")))
            .installStatus(displayValue(server.get("install_status")))
            .assignedTo(displayValue(server.get("assigned_to")))
            .managedBy(displayValue(server.get("managed_by")))
            .ownedBy(displayValue(server.get("owned_by")))
            .supportedBy(displayValue(server.get("supported_by")))
            .supportGroup(displayValue(server.get("support_group")))
            .environment(displayValue(server.has("u_environment")
                ? server.get("u_environment") : server.get("environment")))
            .application(displayValue(server.get("u_application")))
            .criticality(displayValue(server.has("u_criticality")
                ? server.get("u_criticality") : server.get("criticality")))
            .sysCreatedOn(text(server, "sys_created_on"))
            .sysUpdatedOn(text(server, "sys_updated_on"))
            .sysCreatedBy(text(server, "sys_created_by"))
            .sysUpdatedBy(text(server, "sys_updated_by"))
            .discoverySource(text(server, "discovery_source"))
            .lastDiscovered(text(server, "last_discovered"));
        
        Iterator<Map.Entry<String, JsonNode>> fields = server.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith(CUSTOM_FIELD_PREFIX)) {
                builder.customField(field.getKey(), displayValue(field.getValue()));
            }
        }
        
        return builder.build();
    }
    
    /**
     * {@code display_value} of a reference object, else its {@code value}; a scalar as text;
     * null or missing as an empty string.
     */
    static String displayValue(JsonNode field) {
        if (field == null || field.isNull() || field.isMissingNode()) {
            return "";
        }
        if (field.isObject()) {
            if (field.has("display_value")) {
                return scalar(field.get("display_value"));
            }
            return scalar(field.get("value"));
        }
        return scalar(field);
    }
    
    private static String scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return "";
        }
        return node.asText();
    }
    
    private static String text(JsonNode node, String field) {
        return displayValue(node.get(field));
    }
    
    private static String firstNonEmpty(String first, String second) {
        return !first.isEmpty() ? first : second;
    }
}
