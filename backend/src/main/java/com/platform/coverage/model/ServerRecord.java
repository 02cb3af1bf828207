package com.platform.coverage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Normalized CMDB server. Reference fields already hold their display values.
 */
@Value
@Builder
public class ServerRecord {
    
    String sysId;
    String name;
    String hostname;
    String hostnameNormalized;
    String assetTag;
    String serialNumber;
    String fqdn;
    String dnsDomain;
    
    String ipAddress;
    String macAddress;
    
    String sysClassName;
    String category;
    String subcategory;
    String classification;
    
    // Ownership
    String operatingEntity;
    String company;
    String department;
    String location;
    String costCenter;
    String businessUnit;
    
    // Platform
    String os;
    String osVersion;
    String osDomain;
    String cpuCount;
    String cpuType;
    String cpuSpeed;
    String ram;
    String diskSpace;
    String virtual;
    
    String operationalStatus;
    String installStatus;
    
    String assignedTo;
    String managedBy;
    String ownedBy;
    String supportedBy;
    String supportGroup;
    
    String environment;
    String application;
    String criticality;
    
    String sysCreatedOn;
    String sysUpdatedOn;
    String sysCreatedBy;
    String sysUpdatedBy;
    String discoverySource;
    String lastDiscovered;
    
    /**
     * Every {@code u_*} field of the row as its display value, in arrival order. Includes the ones
     * that also feed a dedicated property such as {@code u_environment}.
     */
    @Singular
    Map<String, String> customFields;
    
    public boolean hasHostname() {
        return hostnameNormalized != null && !hostnameNormalized.isEmpty();
    }
}
