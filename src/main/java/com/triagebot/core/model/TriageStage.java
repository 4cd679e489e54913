package com.triagebot.core.model;

/**
 * States of the per-issue triage pipeline, in transition order.
 * {@link #FAILED} is terminal and reachable from every other state.
 */
public enum TriageStage {
    FETCHED,
    CLASSIFIED,
    DUPLICATE_CHECKED,
    PRIORITY_ASSESSED,
    STORED,
    DONE,
    FAILED
}
