package com.triagebot.core.error;

/**
 * Thrown when a vector's dimension differs from the dimension the memory store was configured with.
 */
public class IncompatibleDimensionException extends TriageException {

    private final int expected;
    private final int actual;

    public IncompatibleDimensionException(int expected, int actual) {
        super("Embedding dimension " + actual + " does not match store dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
