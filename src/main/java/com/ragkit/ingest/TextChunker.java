package com.ragkit.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into chunks of at most {@code chunkSize} characters, breaking at the last whitespace
 * inside the window when there is one. Consecutive chunks share {@code chunkOverlap} characters.
 */
public class TextChunker {
    private final int chunkSize;
    private final int chunkOverlap;

    public TextChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize), was " + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public List<String> chunk(String content) {
        List<String> chunks = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return chunks;
        }
        int length = content.length();
        int start = skipWhitespace(content, 0);
        while (start < length) {
            int end = Math.min(length, start + chunkSize);
            if (end < length && !Character.isWhitespace(content.charAt(end))) {
                int boundary = lastWhitespace(content, start, end);
                if (boundary > start) {
                    end = boundary;
                }
            }
            String text = content.substring(start, end).strip();
            if (!text.isEmpty()) {
                chunks.add(text);
            }
            if (end >= length) {
                break;
            }
            int next = Math.max(end - chunkOverlap, start + 1);
            start = chunkOverlap == 0 ? skipWhitespace(content, next) : next;
        }
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int chunkOverlap() {
        return chunkOverlap;
    }

    private static int lastWhitespace(String content, int start, int end) {
        for (int i = end - 1; i > start; i--) {
            if (Character.isWhitespace(content.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int skipWhitespace(String content, int from) {
        int i = from;
        while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
            i++;
        }
        return i;
    }
}
