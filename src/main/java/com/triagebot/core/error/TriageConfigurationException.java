package com.triagebot.core.error;

/**
 * Thrown at construction time when category, keyword or store settings are malformed.
 */
public class TriageConfigurationException extends TriageException {
    public TriageConfigurationException(String message) {
        super(message);
    }
}
