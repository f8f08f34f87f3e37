package com.ragkit.ingest;

import java.util.Locale;

public enum SourceType {
    TEXT,
    FILE,
    WEB_PAGE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
