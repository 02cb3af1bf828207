package com.platform.coverage.error;

/**
 * Thrown when the configuration bundle cannot be turned into a working connector.
 */
public class ConfigurationException extends CoverageException {
    
    private final String property;
    
    public ConfigurationException(String property, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, message);
        this.property = property;
    }
    
    public String getProperty() {
        return property;
    }
}
