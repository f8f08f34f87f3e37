package com.ragkit.store;

public class MissingCitationMetadataException extends VectorStoreException {
    private final String recordId;
    private final String missingKey;

    public MissingCitationMetadataException(String recordId, String missingKey) {
        super("Record '" + recordId + "' has no '" + missingKey + "' metadata; citations need both url and doc_id");
        this.recordId = recordId;
        this.missingKey = missingKey;
    }

    public String recordId() {
        return recordId;
    }

    public String missingKey() {
        return missingKey;
    }
}
