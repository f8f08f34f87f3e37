package com.ragkit.store;

public final class MetadataKeys {
    public static final String URL = "url";
    public static final String DOC_ID = "doc_id";
    public static final String HASH = "hash";
    public static final String DATA_TYPE = "data_type";
    public static final String CHUNK_INDEX = "chunk_index";

    private MetadataKeys() {
    }
}
