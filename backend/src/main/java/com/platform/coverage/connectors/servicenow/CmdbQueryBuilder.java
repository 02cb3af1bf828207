package com.platform.coverage.connectors.servicenow;

/**
 * Builds ServiceNow encoded queries for the CMDB server table.
 */
public final class CmdbQueryBuilder {
    
    private CmdbQueryBuilder() {
    }
    
    /**
     * Match servers whose operating entity or company contains {@code filter}.
     *
     * @return the encoded query, or an empty string when no filter is set
     */
    public static String operatingEntityContains(String filter) {
        if (filter == null || filter.isBlank()) {
            return "";
        }
        String safe = filter.replace("'", "\\'");
        return "u_operating_entityLIKE" + safe
            + "^ORoperating_entityLIKE" + safe
            + "^ORcompanyLIKE" + safe;
    }
}
