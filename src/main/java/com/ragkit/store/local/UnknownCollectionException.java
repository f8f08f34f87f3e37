package com.ragkit.store.local;

/**
 * Raised by {@link LocalVectorEngine} for a collection that was never created or has been deleted.
 */
public class UnknownCollectionException extends RuntimeException {
    UnknownCollectionException(String collection) {
        super("Collection " + collection + " does not exist");
    }
}
