package com.platform.coverage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Normalized Illumio workload. {@code hostnameNormalized} is the reconciliation key.
 */
@Value
@Builder
public class WorkloadRecord {
    
    String href;
    String name;
    String hostname;
    String hostnameNormalized;
    String description;
    String distinguishedName;
    
    // Network
    String primaryIp;
    String allIps;
    String publicIp;
    int interfacesCount;
    
    // State
    boolean online;
    boolean managed;
    String enforcementMode;
    String visibilityLevel;
    
    // Agent
    String agentHref;
    String agentStatus;
    String agentLastHeartbeat;
    String agentMode;
    String agentVisibilityLevel;
    boolean agentLogTraffic;
    String venVersion;
    VenStatus venStatus;
    
    /**
     * Lower-cased status as reported, or the derived one; used for breakdowns.
     */
    String venStatusLabel;
    
    // Operating system
    String osType;
    String osId;
    String osDetail;
    String servicePrincipalName;
    
    String dataCenter;
    String dataCenterZone;
    
    Boolean firewallCoexistence;
    Boolean containersInheritHostPolicy;
    String blockedConnectionAction;
    String vulnerabilityExposureScore;
    
    String createdAt;
    String updatedAt;
    String createdBy;
    boolean deleted;
    String deleteType;
    String caps;
    
    // Labels
    String labelRole;
    String labelApp;
    String labelEnv;
    String labelLoc;
    
    /**
     * Resolved labels other than role/app/env/loc, keyed {@code label_<key>}.
     */
    @Singular
    Map<String, String> extraLabels;
    
    public boolean hasHostname() {
        return hostnameNormalized != null && !hostnameNormalized.isEmpty();
    }
}
