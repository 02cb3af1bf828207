package com.platform.coverage.model;

import java.util.Locale;

/**
 * Lifecycle state of a workload's VEN agent.
 */
public enum VenStatus {
    ACTIVE("active"),
    OFFLINE("offline"),
    SUSPENDED("suspended"),
    UNINSTALLED("uninstalled"),
    UNMANAGED("unmanaged"),
    OTHER("other");   // agent reported a status we do not classify
    
    private final String value;
    
    VenStatus(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    /**
     * Map an agent-reported status string. Unknown strings map to {@link #OTHER}.
     */
    public static VenStatus fromAgentValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VenStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return OTHER;
    }
}
