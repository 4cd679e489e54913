package com.triagebot.core.events;

import com.triagebot.core.model.TriageStage;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Emitted after each triage state transition.
 *
 * @param eventType   e.g. "issue.classified", "issue.stored", "issue.failed", "batch.completed"
 * @param issueNumber the issue this event belongs to, 0 for batch-level events
 * @param stage       the state entered (null for batch-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record TriageEvent(
    String eventType,
    int issueNumber,
    TriageStage stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
