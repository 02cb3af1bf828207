package com.platform.coverage.lifecycle;

import com.platform.coverage.core.AuditOrchestrator;
import com.platform.coverage.error.CoverageException;
import com.platform.coverage.model.ExecutionSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the audit once the context is ready and exposes the outcome as the process exit code:
 * 0 when the run finished without errors, 1 otherwise.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "coverage", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class AuditRunListener implements ExitCodeGenerator {
    
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    
    private final AuditOrchestrator orchestrator;
    private final AtomicInteger exitCode = new AtomicInteger(EXIT_OK);
    
    public AuditRunListener(AuditOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        log.info("Application startup complete, running coverage audit");
        exitCode.set(runAudit());
    }
    
    int runAudit() {
        try {
            ExecutionSummary summary = orchestrator.run();
            return summary.isSuccessful() ? EXIT_OK : EXIT_FAILED;
        } catch (CoverageException e) {
            log.error("Audit aborted [{}, {}]: {}", e.getErrorCode().getCode(),
                e.isFatal() ? "fatal" : "recoverable", e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected error during execution", e);
            return EXIT_FAILED;
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode.get();
    }
}
