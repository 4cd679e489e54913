package com.triagebot.core.model;

import java.io.Serializable;

/**
 * Why and where a single issue's triage stopped.
 *
 * @param issueNumber the issue that failed
 * @param failedStage the stage whose transition failed
 * @param errorType   simple name of the error (e.g. "SourceUnavailableException")
 * @param message     human readable detail
 */
public record FailureRecord(
    int issueNumber,
    TriageStage failedStage,
    String errorType,
    String message
) implements Serializable {}
