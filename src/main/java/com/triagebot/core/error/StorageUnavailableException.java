package com.triagebot.core.error;

/**
 * A memory store call timed out or failed. Recoverable: the calling stage degrades instead of failing.
 */
public class StorageUnavailableException extends TriageException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
