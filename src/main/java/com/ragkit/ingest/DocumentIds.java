package com.ragkit.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-hash identifiers. A chunk id is the SHA-256 of the chunk text followed by the source
 * value, so the same text coming from the same source always maps to one record.
 */
public final class DocumentIds {
    private DocumentIds() {
    }

    public static String chunkId(String chunkText, String sourceValue) {
        return sha256(chunkText + sourceValue);
    }

    public static String documentId(String content, String sourceValue) {
        return sha256(content + sourceValue);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
