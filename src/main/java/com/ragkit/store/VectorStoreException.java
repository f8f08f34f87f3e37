package com.ragkit.store;

/**
 * Root of every failure a {@link VectorStore} reports. Backend-native exceptions never cross the
 * store boundary without being translated into a subclass of this type.
 */
public class VectorStoreException extends RuntimeException {
    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
