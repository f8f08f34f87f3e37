package com.ragkit.embed;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.ragkit.store.BackendUnavailableException;
import com.ragkit.store.http.FakeHttpBackend;

class HttpEmbedderTest {

    @Test
    void shouldOrderVectorsByResponseIndex() {
        RecordingEndpoint endpoint = new RecordingEndpoint(200,
                "{\"data\":[{\"index\":1,\"embedding\":[0.0,1.0]},{\"index\":0,\"embedding\":[1.0,0.0]}]}");
        HttpEmbedder embedder = new HttpEmbedder(endpoint.client(), "http://embed.test/v1/embeddings", "tiny", "key", 2);

        List<float[]> vectors = embedder.embed(List.of("first", "second"));

        assertArrayEquals(new float[] { 1f, 0f }, vectors.get(0));
        assertArrayEquals(new float[] { 0f, 1f }, vectors.get(1));
        assertEquals("tiny", endpoint.lastRequest.path("model").asText());
        assertEquals(2, endpoint.lastRequest.path("input").size());
        assertEquals(2, embedder.vectorDimension());
    }

    @Test
    void shouldReportServerErrorsAsBackendUnavailable() {
        RecordingEndpoint endpoint = new RecordingEndpoint(503, "{\"error\":\"overloaded\"}");
        HttpEmbedder embedder = new HttpEmbedder(endpoint.client(), "http://embed.test/v1/embeddings", null, null, 2);

        BackendUnavailableException error = assertThrows(BackendUnavailableException.class, () -> embedder.embed("text"));

        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    void shouldRejectResponseIndexOutsideInput() {
        RecordingEndpoint endpoint = new RecordingEndpoint(200, "{\"data\":[{\"index\":1,\"embedding\":[1.0,0.0]}]}");
        HttpEmbedder embedder = new HttpEmbedder(endpoint.client(), "http://embed.test/v1/embeddings", null, null, 2);

        BackendUnavailableException error = assertThrows(BackendUnavailableException.class, () -> embedder.embed("text"));

        assertTrue(error.getMessage().contains("index 1"));
    }

    @Test
    void shouldRejectRepeatedResponseIndex() {
        RecordingEndpoint endpoint = new RecordingEndpoint(200,
                "{\"data\":[{\"index\":0,\"embedding\":[1.0,0.0]},{\"index\":0,\"embedding\":[0.0,1.0]}]}");
        HttpEmbedder embedder = new HttpEmbedder(endpoint.client(), "http://embed.test/v1/embeddings", null, null, 2);

        BackendUnavailableException error = assertThrows(BackendUnavailableException.class,
                () -> embedder.embed(List.of("first", "second")));

        assertTrue(error.getMessage().contains("repeats index 0"));
    }

    @Test
    void shouldHashTokensIntoNormalizedVector() {
        HashingEmbedder embedder = new HashingEmbedder(32);

        float[] vector = embedder.embed("Vector stores store vectors");
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }

        assertEquals(32, vector.length);
        assertEquals(1.0, norm, 1e-5);
        assertArrayEquals(vector, embedder.embed("vector STORES store, vectors!"));
    }

    private static final class RecordingEndpoint extends FakeHttpBackend {
        private final int code;
        private final String response;
        private JsonNode lastRequest;

        private RecordingEndpoint(int code, String response) {
            this.code = code;
            this.response = response;
        }

        @Override
        protected Reply handle(String method, String path, String body) throws IOException {
            lastRequest = json(body);
            return new Reply(code, response);
        }
    }
}
