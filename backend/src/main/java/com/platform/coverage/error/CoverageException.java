package com.platform.coverage.error;

/**
 * Base exception for all coverage auditor exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class CoverageException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected CoverageException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected CoverageException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected CoverageException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
