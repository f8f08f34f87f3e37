package com.ragkit.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One nearest-neighbour hit. Distance is lower-is-closer whatever the backend's native score is.
 */
public record QueryMatch(String id, String text, Map<String, Object> metadata, double distance) {
    public QueryMatch {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
