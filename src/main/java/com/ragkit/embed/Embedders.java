package com.ragkit.embed;

import java.util.Locale;

import com.ragkit.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class Embedders {
    static final String API_KEY_ENV = "RAGKIT_EMBEDDING_API_KEY";

    private Embedders() {
    }

    public static Embedder create(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbedder(config.getDimension());
            case "http" -> new HttpEmbedder(httpClient, config.getUrl(), config.getModel(), apiKey(config), config.getDimension());
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        };
    }

    private static String apiKey(AppConfig.EmbeddingConfig config) {
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return System.getenv(API_KEY_ENV);
        }
        return apiKey;
    }
}
