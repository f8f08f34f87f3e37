package com.ragkit.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class FileLoader implements Loader {
    @Override
    public boolean supports(SourceType type) {
        return type == SourceType.FILE;
    }

    @Override
    public LoadedDocument load(Source source) throws IOException {
        Path path = Path.of(source.value());
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a readable file: " + path.toAbsolutePath().normalize());
        }
        return new LoadedDocument(Files.readString(path).strip(), Map.of("file_name", path.getFileName().toString()));
    }
}
