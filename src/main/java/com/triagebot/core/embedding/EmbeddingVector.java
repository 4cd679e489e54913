package com.triagebot.core.embedding;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Fixed-dimension numeric vector. Values are copied in and out so instances stay immutable.
 */
public final class EmbeddingVector implements Serializable {

    private final double[] values;

    public EmbeddingVector(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Embedding vector must have at least one value");
        }
        this.values = values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public double[] values() {
        return values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimension=" + values.length + "]";
    }
}
