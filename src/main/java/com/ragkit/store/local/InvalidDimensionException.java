package com.ragkit.store.local;

/**
 * Raised by {@link LocalVectorEngine} when a vector does not fit a collection.
 */
public class InvalidDimensionException extends RuntimeException {
    private final int expected;
    private final int actual;

    InvalidDimensionException(String collection, int expected, int actual) {
        super("Embedding dimension " + actual + " does not match collection dimensionality " + expected
                + " of " + collection);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
