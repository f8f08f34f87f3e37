package com.ragkit.store;

public class CollectionNotReadyException extends VectorStoreException {
    public CollectionNotReadyException(String collection, StoreState state) {
        super("Collection '" + collection + "' is not ready (state=" + state + ")");
    }

    public CollectionNotReadyException(String collection, String reason) {
        super("Collection '" + collection + "' is not available: " + reason);
    }
}
