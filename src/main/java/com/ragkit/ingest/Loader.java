package com.ragkit.ingest;

import java.io.IOException;

public interface Loader {
    boolean supports(SourceType type);

    LoadedDocument load(Source source) throws IOException;
}
