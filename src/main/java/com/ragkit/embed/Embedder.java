package com.ragkit.embed;

import java.util.List;

public interface Embedder {
    List<float[]> embed(List<String> texts);

    int vectorDimension();

    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
