package com.platform.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a reconciled record was produced.
 */
public enum MatchType {
    HOSTNAME("hostname"),
    NONE("none"),
    ILLUMIO_ONLY("illumio_only");
    
    private final String value;
    
    MatchType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
