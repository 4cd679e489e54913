package com.triagebot.core.memory;

import com.triagebot.core.embedding.CosineSimilarity;
import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.error.IncompatibleDimensionException;
import com.triagebot.core.model.SimilarityMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Shared scoring and ordering for store implementations that rank in the JVM.
 */
final class SimilarityRanking {

    static final Comparator<SimilarityMatch> BEST_FIRST =
            Comparator.comparingDouble(SimilarityMatch::score).reversed()
                    .thenComparingInt(SimilarityMatch::issueNumber);

    private SimilarityRanking() {}

    static void requireDimension(int expected, EmbeddingVector vector) {
        if (vector.dimension() != expected) {
            throw new IncompatibleDimensionException(expected, vector.dimension());
        }
    }

    static List<SimilarityMatch> rank(EmbeddingVector query, Iterable<Map.Entry<Integer, EmbeddingVector>> candidates,
                                      double minScore, int maxResults, Integer excludedIssueNumber) {
        if (maxResults <= 0) {
            return List.of();
        }
        var matches = new ArrayList<SimilarityMatch>();
        for (var candidate : candidates) {
            int number = candidate.getKey();
            if (excludedIssueNumber != null && number == excludedIssueNumber) {
                continue;
            }
            double score = CosineSimilarity.between(query, candidate.getValue());
            if (score >= minScore) {
                matches.add(new SimilarityMatch(number, score));
            }
        }
        matches.sort(BEST_FIRST);
        return matches.size() > maxResults ? List.copyOf(matches.subList(0, maxResults)) : List.copyOf(matches);
    }
}
