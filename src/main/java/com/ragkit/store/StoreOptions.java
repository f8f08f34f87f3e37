package com.ragkit.store;

public record StoreOptions(String collectionName, boolean allowReset, int batchSize, int workers) {
    public static final String DEFAULT_COLLECTION = "embedchain_store";
    public static final int DEFAULT_BATCH_SIZE = 100;

    public StoreOptions {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName must not be blank");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
    }

    public static StoreOptions defaults() {
        return new StoreOptions(DEFAULT_COLLECTION, false, DEFAULT_BATCH_SIZE, 1);
    }

    public StoreOptions withCollectionName(String name) {
        return new StoreOptions(name, allowReset, batchSize, workers);
    }

    public StoreOptions withAllowReset(boolean allow) {
        return new StoreOptions(collectionName, allow, batchSize, workers);
    }

    public StoreOptions withBatchSize(int size) {
        return new StoreOptions(collectionName, allowReset, size, workers);
    }

    public StoreOptions withWorkers(int count) {
        return new StoreOptions(collectionName, allowReset, batchSize, count);
    }
}
