package com.ragkit.store.http;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * In-memory REST backend plugged into OkHttp as an application interceptor. Subclasses answer
 * requests without any network traffic.
 */
public abstract class FakeHttpBackend implements Interceptor {
    private static final MediaType JSON = MediaType.get("application/json");

    protected final ObjectMapper mapper = new ObjectMapper();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public synchronized Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String body = readBody(request);
        calls.add(request.method() + " " + request.url().encodedPath());
        Reply reply = handle(request.method(), request.url().encodedPath(), body);
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("fake")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    protected abstract Reply handle(String method, String path, String body) throws IOException;

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public List<String> calls() {
        return calls;
    }

    public long callCount(String methodAndPath) {
        return calls.stream().filter(methodAndPath::equals).count();
    }

    protected JsonNode json(String body) throws IOException {
        return body.isEmpty() ? mapper.createObjectNode() : mapper.readTree(body);
    }

    protected Reply ok(JsonNode body) {
        return new Reply(200, body.toString());
    }

    protected Reply status(int code, String error) {
        ObjectNode body = mapper.createObjectNode();
        body.set("status", mapper.createObjectNode().put("error", error));
        return new Reply(code, body.toString());
    }

    protected static double cosine(JsonNode a, JsonNode b) {
        double dot = 0;
        double aNorm = 0;
        double bNorm = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i).asDouble();
            double y = b.get(i).asDouble();
            dot += x * y;
            aNorm += x * x;
            bNorm += y * y;
        }
        if (aNorm == 0 || bNorm == 0) {
            return 0;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }

    private static String readBody(Request request) throws IOException {
        if (request.body() == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readUtf8();
    }

    public record Reply(int code, String body) {
    }
}
