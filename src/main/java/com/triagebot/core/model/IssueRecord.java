package com.triagebot.core.model;

import com.triagebot.core.embedding.EmbeddingVector;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A persisted issue in the memory store. One record per issue number; a later upsert replaces it.
 *
 * @param issueNumber unique key within the repository
 * @param title       issue title at the time it was stored
 * @param body        issue body at the time it was stored
 * @param embedding   vector of {@code title + " " + body}
 * @param labels      labels assigned by the classifier
 * @param priority    assessed priority, may be null for records written outside the pipeline
 * @param storedAt    when the record was written
 */
public record IssueRecord(
    int issueNumber,
    String title,
    String body,
    EmbeddingVector embedding,
    Set<String> labels,
    Priority priority,
    Instant storedAt
) implements Serializable {

    public IssueRecord {
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(storedAt, "storedAt");
        title = title != null ? title : "";
        body = body != null ? body : "";
        labels = labels != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(labels))
                : Set.of();
    }
}
