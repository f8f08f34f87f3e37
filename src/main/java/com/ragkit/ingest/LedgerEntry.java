package com.ragkit.ingest;

/**
 * One ingested source as remembered by the {@link SourceLedger}. {@code contentHash} is the
 * document id shared by all chunks of the source.
 */
public record LedgerEntry(
        String pipelineId,
        String contentHash,
        String sourceType,
        String sourceValue,
        String metadataJson,
        boolean uploaded) {

    public LedgerEntry withUploaded(boolean value) {
        return new LedgerEntry(pipelineId, contentHash, sourceType, sourceValue, metadataJson, value);
    }

    boolean sameKey(String otherPipeline, String otherHash) {
        return pipelineId.equals(otherPipeline) && contentHash.equals(otherHash);
    }
}
