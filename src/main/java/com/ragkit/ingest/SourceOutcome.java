package com.ragkit.ingest;

public record SourceOutcome(Source source, Status status, String documentId, int chunks, int added, String error) {

    public enum Status {
        ADDED,
        UNCHANGED,
        EMPTY,
        FAILED
    }

    static SourceOutcome failed(Source source, Exception e) {
        return new SourceOutcome(source, Status.FAILED, null, 0, 0, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    public int skipped() {
        return chunks - added;
    }
}
