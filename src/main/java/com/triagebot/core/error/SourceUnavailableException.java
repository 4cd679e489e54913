package com.triagebot.core.error;

/**
 * An issue source call failed. Aborts the affected issue's pipeline, never a whole batch.
 */
public class SourceUnavailableException extends TriageException {
    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
