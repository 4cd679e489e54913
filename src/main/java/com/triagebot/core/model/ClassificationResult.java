package com.triagebot.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of keyword classification.
 *
 * @param scores     per-category score in [0, 1] rounded to two decimals, in category table order
 * @param labels     selected categories, in category table order
 * @param confidence the highest score, or 0 when no categories are configured
 * @param rawScores  unrounded per-category scores that labels and thresholds are decided on
 */
public record ClassificationResult(
    Map<String, Double> scores,
    Set<String> labels,
    double confidence,
    Map<String, Double> rawScores
) implements Serializable {

    public ClassificationResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        labels = Collections.unmodifiableSet(new LinkedHashSet<>(labels));
        rawScores = Collections.unmodifiableMap(new LinkedHashMap<>(rawScores));
    }

    public ClassificationResult(Map<String, Double> scores, Set<String> labels, double confidence) {
        this(scores, labels, confidence, scores);
    }

    public double score(String category) {
        return scores.getOrDefault(category, 0.0);
    }

    public double rawScore(String category) {
        return rawScores.getOrDefault(category, 0.0);
    }

    public boolean hasLabel(String category) {
        return labels.contains(category);
    }
}
