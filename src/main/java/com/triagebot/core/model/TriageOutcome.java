package com.triagebot.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Either a {@link TriageDecision} or a {@link FailureRecord} for one issue.
 */
public record TriageOutcome(
    int issueNumber,
    TriageDecision decision,
    FailureRecord failure
) implements Serializable {

    public TriageOutcome {
        if ((decision == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of decision or failure must be set");
        }
    }

    public static TriageOutcome success(TriageDecision decision) {
        Objects.requireNonNull(decision, "decision");
        return new TriageOutcome(decision.issue().number(), decision, null);
    }

    public static TriageOutcome failure(FailureRecord failure) {
        Objects.requireNonNull(failure, "failure");
        return new TriageOutcome(failure.issueNumber(), null, failure);
    }

    public boolean succeeded() {
        return decision != null;
    }
}
