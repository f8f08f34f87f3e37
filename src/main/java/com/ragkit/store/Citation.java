package com.ragkit.store;

public record Citation(String context, String source, String documentId) {
}
