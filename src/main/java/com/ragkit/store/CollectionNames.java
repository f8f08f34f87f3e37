package com.ragkit.store;

import java.util.Locale;

/**
 * Physical collection names. The dimension is bound into every name the same way, so a store
 * opened with a different embedder never reads vectors written with another dimension.
 */
public final class CollectionNames {
    public enum Style {
        UNDERSCORES_ALLOWED,
        HYPHENS_ONLY
    }

    private CollectionNames() {
    }

    public static String physicalName(String logicalName, int vectorDimension, Style style) {
        if (logicalName == null || logicalName.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        if (vectorDimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0, was " + vectorDimension);
        }
        String slug = slugify(logicalName);
        if (style == Style.HYPHENS_ONLY) {
            slug = slug.replace('_', '-');
        }
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Collection name '" + logicalName + "' has no usable characters");
        }
        return slug + "-" + vectorDimension;
    }

    static String slugify(String value) {
        String lower = value.toLowerCase(Locale.ROOT).strip();
        String replaced = lower.replaceAll("[^a-z0-9_-]+", "-");
        return replaced.replaceAll("^[-_]+|[-_]+$", "");
    }
}
