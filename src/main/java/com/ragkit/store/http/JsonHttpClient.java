package com.ragkit.store.http;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragkit.store.BackendUnavailableException;
import com.ragkit.store.CollectionNotReadyException;
import com.ragkit.store.VectorStoreException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * JSON request helper for REST-backed stores. Transport failures, authentication failures and
 * server errors become {@link BackendUnavailableException}; other status codes are handed back so
 * adapters can interpret 404 and 409 answers themselves before falling back to
 * {@link #rejected}.
 */
public class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final MediaType NDJSON = MediaType.parse("application/x-ndjson");

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Map<String, String> headers;
    private final String backend;

    public JsonHttpClient(OkHttpClient http, ObjectMapper mapper, String baseUrl, Map<String, String> headers, String backend) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException(backend + " url must not be blank");
        }
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.headers = Map.copyOf(headers);
        this.backend = backend;
    }

    public HttpResult send(String method, String path, Object body) {
        try {
            RequestBody requestBody = body == null ? null : RequestBody.create(mapper.writeValueAsBytes(body), JSON);
            return execute(method, path, requestBody);
        } catch (IOException e) {
            throw new BackendUnavailableException(backend + " " + method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    public HttpResult sendNdjson(String path, String ndjson) {
        return execute("POST", path, RequestBody.create(ndjson, NDJSON));
    }

    /**
     * Sends a request and fails unless the answer is 2xx.
     */
    public JsonNode expectSuccess(String collection, String method, String path, Object body) {
        HttpResult result = send(method, path, body);
        if (!result.isSuccessful()) {
            throw rejected(collection, method, path, result);
        }
        return result.body();
    }

    /**
     * A 404 on a collection-scoped call means the collection is gone, for example dropped by
     * another client; any other rejection is reported with its status code.
     */
    public VectorStoreException rejected(String collection, String method, String path, HttpResult result) {
        String detail = backend + " " + method + " " + path + " answered " + result.code() + " body=" + result.raw();
        if (result.code() == 404) {
            return new CollectionNotReadyException(collection, detail);
        }
        return new BackendUnavailableException(detail);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String backend() {
        return backend;
    }

    private HttpResult execute(String method, String path, RequestBody requestBody) {
        Request.Builder builder = new Request.Builder().url(baseUrl + path);
        headers.forEach(builder::header);
        if (requestBody == null && needsBody(method)) {
            requestBody = RequestBody.create(new byte[0], JSON);
        }
        builder.method(method, requestBody);
        try (Response response = http.newCall(builder.build()).execute()) {
            String raw = response.body() != null ? response.body().string() : "";
            int code = response.code();
            log.debug("http.call backend={} method={} path={} status={}", backend, method, path, code);
            if (code == 401 || code == 403) {
                throw new BackendUnavailableException(backend + " refused credentials for " + method + " " + path + ": " + code);
            }
            if (code >= 500) {
                throw new BackendUnavailableException(backend + " " + method + " " + path + " failed: " + code + " body=" + raw);
            }
            return new HttpResult(code, parse(raw, code), raw);
        } catch (IOException e) {
            throw new BackendUnavailableException(backend + " " + method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    // error pages are not always JSON; only successful answers must parse
    private JsonNode parse(String raw, int code) throws IOException {
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            if (code >= 200 && code < 300) {
                throw e;
            }
            return mapper.createObjectNode();
        }
    }

    private static boolean needsBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    public record HttpResult(int code, JsonNode body, String raw) {
        public boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}
