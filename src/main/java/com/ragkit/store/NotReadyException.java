package com.ragkit.store;

public class NotReadyException extends VectorStoreException {
    public NotReadyException(String operation) {
        super("Vector store is not initialized; call initialize(embedder) before " + operation);
    }
}
