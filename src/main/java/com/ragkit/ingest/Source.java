package com.ragkit.ingest;

import java.util.Map;
import java.util.Objects;

/**
 * One logical input of an ingestion run: pasted text, a local file or a web page.
 */
public record Source(SourceType type, String value, Map<String, Object> metadata) {
    public Source {
        Objects.requireNonNull(type, "type");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source value must not be blank");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Source text(String text) {
        return new Source(SourceType.TEXT, text, Map.of());
    }

    public static Source file(String path) {
        return new Source(SourceType.FILE, path, Map.of());
    }

    public static Source webPage(String url) {
        return new Source(SourceType.WEB_PAGE, url, Map.of());
    }

    public Source withMetadata(Map<String, Object> extra) {
        return new Source(type, value, extra);
    }
}
