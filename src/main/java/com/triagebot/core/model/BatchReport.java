package com.triagebot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Per-issue outcomes of a bulk retriage, in input order, with totals.
 */
public record BatchReport(
    List<TriageOutcome> outcomes,
    int succeeded,
    int failed
) implements Serializable {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public static BatchReport of(List<TriageOutcome> outcomes) {
        int ok = (int) outcomes.stream().filter(TriageOutcome::succeeded).count();
        return new BatchReport(outcomes, ok, outcomes.size() - ok);
    }

    public List<TriageDecision> decisions() {
        return outcomes.stream().filter(TriageOutcome::succeeded).map(TriageOutcome::decision).toList();
    }

    public List<FailureRecord> failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).map(TriageOutcome::failure).toList();
    }
}
