package com.triagebot.core.embedding;

/**
 * Maps text to a fixed-dimension vector. Implementations must be deterministic:
 * the same text and dimension always yield an equal vector.
 */
public interface Embedder {

    EmbeddingVector embed(String text, int dimension);

    /**
     * Dimension used by {@link #embed(String)}.
     */
    int dimension();

    default EmbeddingVector embed(String text) {
        return embed(text, dimension());
    }
}
