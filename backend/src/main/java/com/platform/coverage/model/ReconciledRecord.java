package com.platform.coverage.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Joined view of at most one workload and one server sharing a hostname key.
 * At least one side is always present.
 */
public record ReconciledRecord(
    String hostnameNormalized,
    WorkloadRecord workload,
    ServerRecord server,
    ReconciliationStatus status,
    MatchType matchType
) {
    
    public ReconciledRecord {
        if (workload == null && server == null) {
            throw new IllegalArgumentException("a reconciled record needs a workload or a server");
        }
        hostnameNormalized = hostnameNormalized != null ? hostnameNormalized : "";
    }
    
    public Optional<WorkloadRecord> findWorkload() {
        return Optional.ofNullable(workload);
    }
    
    public String environment() {
        return firstNonEmpty(server != null ? server.getEnvironment() : null,
            workload != null ? workload.getLabelEnv() : null);
    }
    
    public String application() {
        return firstNonEmpty(server != null ? server.getApplication() : null,
            workload != null ? workload.getLabelApp() : null);
    }
    
    public String operatingEntity() {
        return firstNonEmpty(server != null ? server.getOperatingEntity() : null, null);
    }
    
    public String venStatusLabel() {
        return workload != null ? nz(workload.getVenStatusLabel()) : "";
    }
    
    public String enforcementMode() {
        return workload != null ? nz(workload.getEnforcementMode()) : "";
    }
    
    public String venVersion() {
        return workload != null ? nz(workload.getVenVersion()) : "";
    }
    
    /**
     * Flattened row with {@code cmdb_*} and {@code illumio_*} columns, for report sinks.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        
        row.put("cmdb_sys_id", server != null ? nz(server.getSysId()) : "");
        row.put("cmdb_name", server != null ? nz(server.getName()) : "");
        row.put("cmdb_hostname", server != null ? nz(server.getHostname()) : "");
        row.put("cmdb_ip_address", server != null ? nz(server.getIpAddress()) : "");
        row.put("cmdb_operating_entity", server != null ? nz(server.getOperatingEntity()) : "");
        row.put("cmdb_environment", server != null ? nz(server.getEnvironment()) : "");
        row.put("cmdb_application", server != null ? nz(server.getApplication()) : "");
        row.put("cmdb_os", server != null ? nz(server.getOs()) : "");
        row.put("cmdb_operational_status", server != null ? nz(server.getOperationalStatus()) : "");
        row.put("cmdb_location", server != null ? nz(server.getLocation()) : "");
        row.put("cmdb_assigned_to", server != null ? nz(server.getAssignedTo()) : "");
        
        row.put("illumio_href", workload != null ? nz(workload.getHref()) : "");
        row.put("illumio_hostname", workload != null ? nz(workload.getHostname()) : "");
        row.put("illumio_name", workload != null ? nz(workload.getName()) : "");
        row.put("illumio_primary_ip", workload != null ? nz(workload.getPrimaryIp()) : "");
        row.put("illumio_online", workload != null ? yesNo(workload.isOnline()) : "");
        row.put("illumio_managed", workload != null ? yesNo(workload.isManaged()) : "");
        row.put("illumio_ven_status", venStatusLabel());
        row.put("illumio_ven_version", venVersion());
        row.put("illumio_enforcement_mode", enforcementMode());
        row.put("illumio_visibility_level", workload != null ? nz(workload.getVisibilityLevel()) : "");
        row.put("illumio_os_type", workload != null ? nz(workload.getOsType()) : "");
        row.put("illumio_label_app", workload != null ? nz(workload.getLabelApp()) : "");
        row.put("illumio_label_env", workload != null ? nz(workload.getLabelEnv()) : "");
        row.put("illumio_label_role", workload != null ? nz(workload.getLabelRole()) : "");
        row.put("illumio_label_loc", workload != null ? nz(workload.getLabelLoc()) : "");
        row.put("illumio_last_heartbeat", workload != null ? nz(workload.getAgentLastHeartbeat()) : "");
        
        row.put("hostname_normalized", hostnameNormalized);
        row.put("reconciliation_status", status.getValue());
        row.put("match_type", matchType.getValue());
        return row;
    }
    
    private static String firstNonEmpty(String first, String second) {
        if (first != null && !first.isEmpty()) {
            return first;
        }
        return second != null ? second : "";
    }
    
    private static String nz(String value) {
        return value != null ? value : "";
    }
    
    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
