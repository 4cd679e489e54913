package com.triagebot.dispatch;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.engine.TriageEngine;
import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.model.BatchReport;
import com.triagebot.core.model.FailureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Re-triages every open issue once at startup when {@code triage.retriage-on-startup}
 * is set. The exit code is 1 if listing failed or any issue failed.
 */
@Component
public class StartupRetriageRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StartupRetriageRunner.class);

    private final TriageEngine engine;
    private final TriageProperties properties;
    private int exitCode;

    public StartupRetriageRunner(TriageEngine engine, TriageProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (!properties.isRetriageOnStartup()) {
            log.debug("Startup retriage disabled");
            return;
        }
        try {
            BatchReport report = engine.retriageOpenIssues();
            for (FailureRecord failure : report.failures()) {
                log.warn("Issue #{} failed at {}: {} {}", failure.issueNumber(), failure.failedStage(),
                        failure.errorType(), failure.message());
            }
            exitCode = report.failed() > 0 ? 1 : 0;
        } catch (SourceUnavailableException e) {
            log.error("Startup retriage could not list open issues: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
