package com.ragkit.store;

import java.util.List;

/**
 * Raised when one batch of a batched write fails. Batches listed as skipped were never sent.
 * Records of succeeded batches stay in the store; nothing is rolled back.
 */
public class BatchPartialFailureException extends VectorStoreException {
    private final List<Integer> succeededBatches;
    private final List<Integer> failedBatches;
    private final List<Integer> skippedBatches;

    public BatchPartialFailureException(
            List<Integer> succeededBatches,
            List<Integer> failedBatches,
            List<Integer> skippedBatches,
            Throwable cause) {
        super("Batched write failed: succeeded=%s failed=%s skipped=%s cause=%s".formatted(
                succeededBatches, failedBatches, skippedBatches, cause == null ? "unknown" : cause.getMessage()), cause);
        this.succeededBatches = List.copyOf(succeededBatches);
        this.failedBatches = List.copyOf(failedBatches);
        this.skippedBatches = List.copyOf(skippedBatches);
    }

    public List<Integer> succeededBatches() {
        return succeededBatches;
    }

    public List<Integer> failedBatches() {
        return failedBatches;
    }

    public List<Integer> skippedBatches() {
        return skippedBatches;
    }
}
