package com.ragkit.store.qdrant;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragkit.store.AbstractVectorStore;
import com.ragkit.store.CollectionNames;
import com.ragkit.store.DimensionMismatchException;
import com.ragkit.store.Filter;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.VectorRecord;
import com.ragkit.store.http.JsonHttpClient;
import com.ragkit.store.http.JsonHttpClient.HttpResult;

import okhttp3.OkHttpClient;

/**
 * Qdrant adapter over the REST API. Qdrant point ids must be UUIDs or integers, so each record id
 * is mapped to a name-based UUID and kept in the {@code identifier} payload field next to
 * {@code text} and {@code metadata}.
 */
public class QdrantVectorStore extends AbstractVectorStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStore.class);
    private static final Pattern DIMENSION_ERROR = Pattern.compile("expected dim: (\\d+), got (\\d+)");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };
    static final String IDENTIFIER = "identifier";

    private final JsonHttpClient client;
    private final ObjectMapper mapper;

    public QdrantVectorStore(JsonHttpClient client, StoreOptions options) {
        super(options);
        this.client = client;
        this.mapper = client.mapper();
    }

    public static QdrantVectorStore connect(OkHttpClient http, String url, String apiKey, StoreOptions options) {
        Map<String, String> headers = new HashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("api-key", apiKey);
        }
        return new QdrantVectorStore(new JsonHttpClient(http, new ObjectMapper(), url, headers, "qdrant"), options);
    }

    @Override
    protected CollectionNames.Style nameStyle() {
        return CollectionNames.Style.HYPHENS_ONLY;
    }

    @Override
    protected void nativeEnsureCollection(String collection, int dimension) {
        HttpResult existing = client.send("GET", "/collections/" + collection, null);
        if (existing.isSuccessful()) {
            JsonNode size = existing.body().path("result").path("config").path("params").path("vectors").path("size");
            if (size.isInt() && size.asInt() != dimension) {
                throw new DimensionMismatchException(collection, size.asInt(), dimension);
            }
            return;
        }
        if (existing.code() != 404) {
            throw client.rejected(collection, "GET", "/collections/" + collection, existing);
        }
        ObjectNode vectors = mapper.createObjectNode().put("size", dimension).put("distance", "Cosine");
        ObjectNode body = mapper.createObjectNode();
        body.set("vectors", vectors);
        HttpResult created = client.send("PUT", "/collections/" + collection, body);
        if (!created.isSuccessful() && created.code() != 409) {
            throw client.rejected(collection, "PUT", "/collections/" + collection, created);
        }
        log.info("qdrant.collection.created collection={} size={}", collection, dimension);
    }

    @Override
    protected void nativeDropCollection(String collection) {
        HttpResult result = client.send("DELETE", "/collections/" + collection, null);
        if (!result.isSuccessful() && result.code() != 404) {
            throw client.rejected(collection, "DELETE", "/collections/" + collection, result);
        }
    }

    @Override
    protected Set<String> nativeExisting(String collection, List<String> ids, Filter where) {
        ArrayNode must = mapper.createArrayNode();
        must.add(matchCondition(IDENTIFIER, "any", mapper.valueToTree(ids)));
        must.addAll(compileConditions(where));

        Set<String> found = new LinkedHashSet<>();
        JsonNode offset = null;
        do {
            ObjectNode body = mapper.createObjectNode();
            body.set("filter", mapper.createObjectNode().set("must", must));
            body.put("limit", ids.size());
            body.set("with_payload", mapper.createArrayNode().add(IDENTIFIER));
            body.put("with_vector", false);
            if (offset != null) {
                body.set("offset", offset);
            }
            JsonNode result = client.expectSuccess(collection, "POST", "/collections/" + collection + "/points/scroll", body).path("result");
            result.path("points").forEach(point -> found.add(point.path("payload").path(IDENTIFIER).asText()));
            JsonNode next = result.path("next_page_offset");
            offset = next.isMissingNode() || next.isNull() ? null : next;
        } while (offset != null);
        return found;
    }

    @Override
    protected void nativeInsert(String collection, List<VectorRecord> batch) {
        Set<String> existing = nativeExisting(collection, batch.stream().map(VectorRecord::id).toList(), Filter.all());
        ArrayNode points = mapper.createArrayNode();
        for (VectorRecord record : batch) {
            if (existing.contains(record.id())) {
                continue;
            }
            ObjectNode payload = mapper.createObjectNode();
            payload.put(IDENTIFIER, record.id());
            payload.put("text", record.text());
            payload.set("metadata", mapper.valueToTree(record.metadata()));

            ObjectNode point = mapper.createObjectNode();
            point.put("id", pointId(record.id()));
            point.set("vector", floatArray(record.embedding()));
            point.set("payload", payload);
            points.add(point);
        }
        if (points.isEmpty()) {
            log.debug("qdrant.upsert.skipped collection={} existing={}", collection, existing.size());
            return;
        }
        ObjectNode body = mapper.createObjectNode();
        body.set("points", points);
        HttpResult result = client.send("PUT", "/collections/" + collection + "/points?wait=true", body);
        if (result.code() == 400) {
            throwIfDimensionError(collection, result);
        }
        if (!result.isSuccessful()) {
            throw client.rejected(collection, "PUT", "/collections/" + collection + "/points", result);
        }
    }

    @Override
    protected List<QueryMatch> nativeSearch(String collection, float[] vector, int nResults, Filter where) {
        ObjectNode body = mapper.createObjectNode();
        body.set("vector", floatArray(vector));
        body.put("limit", nResults);
        body.put("with_payload", true);
        ArrayNode conditions = compileConditions(where);
        if (!conditions.isEmpty()) {
            body.set("filter", mapper.createObjectNode().set("must", conditions));
        }
        HttpResult result = client.send("POST", "/collections/" + collection + "/points/search", body);
        if (result.code() == 400) {
            throwIfDimensionError(collection, result);
        }
        if (!result.isSuccessful()) {
            throw client.rejected(collection, "POST", "/collections/" + collection + "/points/search", result);
        }
        List<QueryMatch> matches = new ArrayList<>();
        for (JsonNode point : result.body().path("result")) {
            JsonNode payload = point.path("payload");
            JsonNode metadata = payload.path("metadata");
            matches.add(new QueryMatch(
                    payload.path(IDENTIFIER).asText(),
                    payload.path("text").asText(),
                    metadata.isObject() ? mapper.convertValue(metadata, METADATA_TYPE) : Map.of(),
                    1.0 - point.path("score").asDouble()));
        }
        return matches;
    }

    @Override
    protected long nativeCount(String collection) {
        ObjectNode body = mapper.createObjectNode().put("exact", true);
        return client.expectSuccess(collection, "POST", "/collections/" + collection + "/points/count", body)
                .path("result").path("count").asLong();
    }

    @Override
    protected void nativeDelete(String collection, Filter where) {
        ObjectNode body = mapper.createObjectNode();
        body.set("filter", mapper.createObjectNode().set("must", compileConditions(where)));
        client.expectSuccess(collection, "POST", "/collections/" + collection + "/points/delete?wait=true", body);
    }

    @Override
    protected AbstractVectorStore newView(StoreOptions viewOptions) {
        return new QdrantVectorStore(client, viewOptions);
    }

    static String pointId(String recordId) {
        return UUID.nameUUIDFromBytes(recordId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    ArrayNode compileConditions(Filter where) {
        ArrayNode out = mapper.createArrayNode();
        for (Filter condition : where.conditions()) {
            if (condition instanceof Filter.Eq eq) {
                out.add(matchCondition("metadata." + eq.field(), "value", mapper.valueToTree(eq.value())));
            } else if (condition instanceof Filter.In in) {
                out.add(matchCondition("metadata." + in.field(), "any", mapper.valueToTree(in.values())));
            } else {
                throw new IllegalArgumentException("Unsupported filter " + condition);
            }
        }
        return out;
    }

    private ObjectNode matchCondition(String key, String kind, JsonNode value) {
        ObjectNode condition = mapper.createObjectNode();
        condition.put("key", key);
        condition.set("match", mapper.createObjectNode().set(kind, value));
        return condition;
    }

    private void throwIfDimensionError(String collection, HttpResult result) {
        Matcher matcher = DIMENSION_ERROR.matcher(result.raw());
        if (matcher.find()) {
            throw new DimensionMismatchException(collection, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        }
    }

    private ArrayNode floatArray(float[] vector) {
        ArrayNode array = mapper.createArrayNode();
        for (float value : vector) {
            array.add(value);
        }
        return array;
    }
}
