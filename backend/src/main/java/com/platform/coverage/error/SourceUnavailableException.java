package com.platform.coverage.error;

/**
 * Exception for an inventory source that cannot be reached or read.
 */
public class SourceUnavailableException extends CoverageException {
    
    private final String sourceName;
    
    public SourceUnavailableException(ErrorCode errorCode, String sourceName, String message) {
        super(errorCode, message);
        this.sourceName = sourceName;
    }
    
    public SourceUnavailableException(ErrorCode errorCode, String sourceName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.sourceName = sourceName;
    }
    
    public static SourceUnavailableException pce(String message) {
        return new SourceUnavailableException(
            ErrorCode.PCE_UNAVAILABLE,
            "illumio",
            message
        );
    }
    
    public String getSourceName() {
        return sourceName;
    }
}
