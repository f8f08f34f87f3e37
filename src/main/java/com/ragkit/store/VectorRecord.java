package com.ragkit.store;

import java.util.Map;

public record VectorRecord(String id, String text, Map<String, Object> metadata, float[] embedding) {
    public VectorRecord {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
