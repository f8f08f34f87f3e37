package com.ragkit.store;

public class BackendUnavailableException extends VectorStoreException {
    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
