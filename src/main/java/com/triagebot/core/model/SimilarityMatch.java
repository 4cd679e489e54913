package com.triagebot.core.model;

import java.io.Serializable;

/**
 * A stored issue ranked against a query vector.
 *
 * @param issueNumber the stored issue
 * @param score       cosine similarity in [-1, 1]
 */
public record SimilarityMatch(
    int issueNumber,
    double score
) implements Serializable {}
