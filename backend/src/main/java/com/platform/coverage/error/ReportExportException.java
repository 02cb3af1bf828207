package com.platform.coverage.error;

/**
 * A report sink could not write its output. Never aborts a run.
 */
public class ReportExportException extends CoverageException {
    
    private final String sinkName;
    
    public ReportExportException(String sinkName, String message, Throwable cause) {
        super(ErrorCode.REPORT_EXPORT_FAILED, message, cause);
        this.sinkName = sinkName;
    }
    
    public String getSinkName() {
        return sinkName;
    }
}
