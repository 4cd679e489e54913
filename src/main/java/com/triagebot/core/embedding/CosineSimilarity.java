package com.triagebot.core.embedding;

import com.triagebot.core.error.IncompatibleDimensionException;

/**
 * Cosine similarity between equal-length vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {}

    /**
     * Returns the cosine of the angle between {@code a} and {@code b}, in [-1, 1].
     * A zero-magnitude vector has similarity 0 with everything.
     *
     * @throws IncompatibleDimensionException if the vectors differ in length
     */
    public static double between(EmbeddingVector a, EmbeddingVector b) {
        if (a.dimension() != b.dimension()) {
            throw new IncompatibleDimensionException(a.dimension(), b.dimension());
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.dimension(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        // sqrt of the product keeps self-similarity at exactly 1.0
        double score = dot / Math.sqrt(normA * normB);
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
