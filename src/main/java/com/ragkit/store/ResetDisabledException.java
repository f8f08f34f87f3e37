package com.ragkit.store;

public class ResetDisabledException extends VectorStoreException {
    public ResetDisabledException(String collection) {
        super("Resetting is disabled for collection '" + collection
                + "'. Enable it by setting store.allowReset=true in the store configuration");
    }
}
