package com.platform.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final classification of a reconciled record.
 */
public enum ReconciliationStatus {
    DEPLOYED_ACTIVE("deployed_active"),
    DEPLOYED_OFFLINE("deployed_offline"),
    DEPLOYED_SUSPENDED("deployed_suspended"),
    DEPLOYED_UNINSTALLED("deployed_uninstalled"),
    NOT_DEPLOYED("not_deployed"),        // in the CMDB, no workload
    NOT_IN_CMDB("not_in_cmdb");          // workload without a CMDB entry (shadow IT)
    
    private final String value;
    
    ReconciliationStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Whether a VEN is currently installed (active, offline or suspended).
     */
    public boolean isCurrentlyDeployed() {
        return switch (this) {
            case DEPLOYED_ACTIVE, DEPLOYED_OFFLINE, DEPLOYED_SUSPENDED -> true;
            case DEPLOYED_UNINSTALLED, NOT_DEPLOYED, NOT_IN_CMDB -> false;
        };
    }
    
    @Override
    public String toString() {
        return value;
    }
}
