package com.ragkit.ingest;

import java.util.Map;

public class TextLoader implements Loader {
    @Override
    public boolean supports(SourceType type) {
        return type == SourceType.TEXT;
    }

    @Override
    public LoadedDocument load(Source source) {
        return new LoadedDocument(source.value().strip(), Map.of());
    }
}
