package com.triagebot.core.model;

/**
 * Estimated effort to resolve an issue.
 */
public enum Complexity {
    SIMPLE,
    MEDIUM,
    COMPLEX
}
