package com.triagebot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured triage result for one issue.
 * <p>
 * A decision is a success even when a memory stage was degraded; callers must check
 * {@code duplicatesChecked} and {@code stored}, and read {@code warnings} for the detail.
 *
 * @param issue             the issue as triaged (after any refresh from the source)
 * @param classification    keyword classification
 * @param priority          assessed priority
 * @param complexity        assessed complexity
 * @param duplicates        matches above the duplicate threshold, best first
 * @param duplicatesChecked whether the duplicate query actually ran
 * @param stored            whether the issue record was written to the memory store
 * @param warnings          error details of degraded stages
 */
public record TriageDecision(
    Issue issue,
    ClassificationResult classification,
    Priority priority,
    Complexity complexity,
    List<SimilarityMatch> duplicates,
    boolean duplicatesChecked,
    boolean stored,
    List<String> warnings
) implements Serializable {

    public TriageDecision {
        duplicates = List.copyOf(duplicates);
        warnings = List.copyOf(warnings);
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    public boolean degraded() {
        return !warnings.isEmpty();
    }
}
