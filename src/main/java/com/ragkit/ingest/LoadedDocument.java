package com.ragkit.ingest;

import java.util.Map;

public record LoadedDocument(String content, Map<String, Object> metadata) {
    public LoadedDocument {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
