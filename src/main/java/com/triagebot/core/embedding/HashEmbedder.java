package com.triagebot.core.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Placeholder embedder that expands a SHA-256 digest of the text into a vector.
 * <p>
 * Position {@code i} takes digest byte {@code i mod 32}, read unsigned and scaled
 * into [-1, 1]. Identical text gives an identical vector on every JVM; the values carry
 * no semantic meaning, so only exact repeats score as similar.
 */
public class HashEmbedder implements Embedder {

    public static final int DEFAULT_DIMENSION = 384;

    private final int dimension;

    public HashEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashEmbedder(int dimension) {
        requirePositive(dimension);
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public EmbeddingVector embed(String text, int dimension) {
        requirePositive(dimension);
        byte[] digest = sha256(text != null ? text : "");

        double[] values = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            int unsigned = digest[i % digest.length] & 0xFF;
            values[i] = (unsigned / 255.0) * 2 - 1;
        }
        return new EmbeddingVector(values);
    }

    private static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void requirePositive(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive, got " + dimension);
        }
    }
}
