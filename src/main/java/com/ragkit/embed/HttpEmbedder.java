package com.ragkit.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragkit.store.BackendUnavailableException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Client for OpenAI-compatible {@code /embeddings} endpoints. Responses must carry
 * {@code data[].embedding}; entries are re-ordered by {@code data[].index} when present.
 */
public class HttpEmbedder implements Embedder {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpEmbedder(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("embedding endpoint must not be blank");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("input", texts);
            if (model != null && !model.isBlank()) {
                payload.put("model", model);
            }
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    throw new BackendUnavailableException(
                            "Embedding request to " + endpoint + " failed: " + response.code() + " body=" + body);
                }
                return parse(mapper.readTree(body), texts.size());
            }
        } catch (IOException e) {
            throw new BackendUnavailableException("Embedding request to " + endpoint + " failed", e);
        }
    }

    @Override
    public int vectorDimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "http-" + (model == null ? "default" : model);
    }

    private List<float[]> parse(JsonNode root, int expected) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new BackendUnavailableException(
                    "Embedding response from " + endpoint + " has " + data.size() + " vectors, expected " + expected);
        }
        float[][] ordered = new float[expected][];
        for (int position = 0; position < data.size(); position++) {
            JsonNode item = data.get(position);
            int index = item.path("index").asInt(position);
            if (index < 0 || index >= expected) {
                throw new BackendUnavailableException(
                        "Embedding response from " + endpoint + " has index " + index + " outside 0.." + (expected - 1));
            }
            if (ordered[index] != null) {
                throw new BackendUnavailableException("Embedding response from " + endpoint + " repeats index " + index);
            }
            JsonNode vectorNode = item.path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new BackendUnavailableException("Embedding response from " + endpoint + " has no vector at index " + index);
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            ordered[index] = out;
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (float[] vector : ordered) {
            vectors.add(vector);
        }
        return vectors;
    }
}
