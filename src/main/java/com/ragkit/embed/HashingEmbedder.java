package com.ragkit.embed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Offline bag-of-words embedder: every token is hashed into one of {@code dimension} buckets and
 * the vector is L2-normalized. Texts sharing words end up close under cosine distance.
 */
public class HashingEmbedder implements Embedder {
    private static final Pattern NON_WORD = Pattern.compile("\\W+");

    private final int dimension;

    public HashingEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    public int vectorDimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null) {
            return vector;
        }
        NON_WORD.splitAsStream(text.toLowerCase(Locale.ROOT))
                .filter(token -> !token.isEmpty())
                .forEach(token -> vector[Math.floorMod(token.hashCode(), dimension)]++);
        return normalize(vector);
    }

    private static float[] normalize(float[] vector) {
        float squares = 0f;
        for (float v : vector) {
            squares += v * v;
        }
        if (squares == 0f) {
            return vector;
        }
        float norm = (float) Math.sqrt(squares);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }
}
