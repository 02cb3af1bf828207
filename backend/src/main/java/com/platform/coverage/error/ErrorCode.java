package com.platform.coverage.error;

/**
 * Standardized error codes for the coverage auditor.
 * 
 * Format: CA-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration errors
 * - 4xx: Source errors (PCE, CMDB)
 * - 5xx: Processing errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Configuration Errors (1xx) ====================
    
    INVALID_FIELD_VALUE("CA-101", "Invalid configuration value", ErrorCategory.FATAL),
    
    // ==================== Source Errors (4xx) ====================
    
    PCE_UNAVAILABLE("CA-400", "Illumio PCE unavailable", ErrorCategory.FATAL),
    PCE_FETCH_FAILED("CA-401", "Illumio PCE fetch failed", ErrorCategory.FATAL),
    CMDB_UNAVAILABLE("CA-410", "ServiceNow CMDB unavailable", ErrorCategory.RECOVERABLE),
    CMDB_FETCH_FAILED("CA-411", "ServiceNow CMDB fetch failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Processing Errors (5xx) ====================
    
    REPORT_EXPORT_FAILED("CA-510", "Report export failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("CA-900", "Unexpected error occurred", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * The run can continue, possibly with reduced output.
         */
        RECOVERABLE,
        
        /**
         * The run cannot produce a meaningful result.
         */
        FATAL
    }
}
