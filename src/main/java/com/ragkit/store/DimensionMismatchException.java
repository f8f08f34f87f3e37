package com.ragkit.store;

public class DimensionMismatchException extends VectorStoreException {
    private final int expectedDimension;
    private final int actualDimension;

    public DimensionMismatchException(String collection, int expectedDimension, int actualDimension) {
        this(collection, expectedDimension, actualDimension, null);
    }

    public DimensionMismatchException(String collection, int expectedDimension, int actualDimension, Throwable cause) {
        super(("Collection '%s' stores vectors of dimension %d but received a vector of dimension %d. "
                + "This usually means a different embedder was used to query than to add the data.")
                .formatted(collection, expectedDimension, actualDimension), cause);
        this.expectedDimension = expectedDimension;
        this.actualDimension = actualDimension;
    }

    public int expectedDimension() {
        return expectedDimension;
    }

    public int actualDimension() {
        return actualDimension;
    }
}
