package com.ragkit.store;

public class EmbedderRequiredException extends VectorStoreException {
    public EmbedderRequiredException() {
        super("Cannot initialize a vector store without an embedder");
    }
}
