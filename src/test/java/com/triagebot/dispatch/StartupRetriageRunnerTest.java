package com.triagebot.dispatch;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.engine.TriageEngine;
import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.model.BatchReport;
import com.triagebot.core.model.FailureRecord;
import com.triagebot.core.model.TriageOutcome;
import com.triagebot.core.model.TriageStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StartupRetriageRunnerTest {

    private TriageEngine engine;
    private TriageProperties properties;
    private StartupRetriageRunner runner;

    @BeforeEach
    void setUp() {
        engine = mock(TriageEngine.class);
        properties = new TriageProperties();
        runner = new StartupRetriageRunner(engine, properties);
    }

    @Test
    @DisplayName("does nothing when startup retriage is disabled")
    void disabled() {
        runner.run();

        verifyNoInteractions(engine);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    @DisplayName("exit code is 1 when any issue failed")
    void failedIssue() {
        properties.setRetriageOnStartup(true);
        when(engine.retriageOpenIssues()).thenReturn(BatchReport.of(List.of(TriageOutcome.failure(
                new FailureRecord(3, TriageStage.FETCHED, "SourceUnavailableException", "502")))));

        runner.run();

        assertEquals(1, runner.getExitCode());
    }

    @Test
    @DisplayName("exit code is 0 when every issue succeeded")
    void allSucceeded() {
        properties.setRetriageOnStartup(true);
        when(engine.retriageOpenIssues()).thenReturn(BatchReport.of(List.of()));

        runner.run();

        assertEquals(0, runner.getExitCode());
    }

    @Test
    @DisplayName("exit code is 1 when open issues cannot be listed")
    void listingFails() {
        properties.setRetriageOnStartup(true);
        when(engine.retriageOpenIssues()).thenThrow(new SourceUnavailableException("No issue source configured"));

        runner.run();

        assertEquals(1, runner.getExitCode());
    }
}
