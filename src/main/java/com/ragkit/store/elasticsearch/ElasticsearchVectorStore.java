package com.ragkit.store.elasticsearch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragkit.store.AbstractVectorStore;
import com.ragkit.store.BackendUnavailableException;
import com.ragkit.store.CollectionNames;
import com.ragkit.store.CollectionNotReadyException;
import com.ragkit.store.DimensionMismatchException;
import com.ragkit.store.Filter;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.VectorRecord;
import com.ragkit.store.http.JsonHttpClient;
import com.ragkit.store.http.JsonHttpClient.HttpResult;

import okhttp3.OkHttpClient;

/**
 * Elasticsearch/OpenSearch adapter. Each collection is an index with a {@code text} field, a
 * {@code metadata} object whose string leaves are keywords and a {@code dense_vector} field named
 * {@code embeddings}. Similarity search is exact cosine scoring through {@code script_score}.
 */
public class ElasticsearchVectorStore extends AbstractVectorStore {
    private static final Logger log = LoggerFactory.getLogger(ElasticsearchVectorStore.class);
    private static final Pattern DIMENSION_ERROR = Pattern.compile(
            "different number of dimensions \\[(\\d+)\\] than the document vectors \\[(\\d+)\\]");
    private static final String SCORE_SCRIPT = "cosineSimilarity(params.query_vector, 'embeddings') + 1.0";
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JsonHttpClient client;
    private final ObjectMapper mapper;

    public ElasticsearchVectorStore(JsonHttpClient client, StoreOptions options) {
        super(options);
        this.client = client;
        this.mapper = client.mapper();
    }

    public static ElasticsearchVectorStore connect(OkHttpClient http, String url, String apiKey, StoreOptions options) {
        Map<String, String> headers = new HashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "ApiKey " + apiKey);
        }
        return new ElasticsearchVectorStore(new JsonHttpClient(http, new ObjectMapper(), url, headers, "elasticsearch"), options);
    }

    @Override
    protected CollectionNames.Style nameStyle() {
        return CollectionNames.Style.UNDERSCORES_ALLOWED;
    }

    @Override
    protected void nativeEnsureCollection(String index, int dimension) {
        HttpResult head = client.send("HEAD", "/" + index, null);
        if (head.isSuccessful()) {
            return;
        }
        if (head.code() != 404) {
            throw client.rejected(index, "HEAD", "/" + index, head);
        }
        HttpResult created = client.send("PUT", "/" + index, indexSettings(dimension));
        if (!created.isSuccessful() && !created.raw().contains("resource_already_exists_exception")) {
            throw client.rejected(index, "PUT", "/" + index, created);
        }
        log.info("elasticsearch.index.created index={} dims={}", index, dimension);
    }

    @Override
    protected void nativeDropCollection(String index) {
        HttpResult result = client.send("DELETE", "/" + index, null);
        if (!result.isSuccessful() && result.code() != 404) {
            throw client.rejected(index, "DELETE", "/" + index, result);
        }
    }

    @Override
    protected Set<String> nativeExisting(String index, List<String> ids, Filter where) {
        ObjectNode body = mapper.createObjectNode();
        body.put("size", ids.size());
        body.put("_source", false);
        ArrayNode filters = mapper.createArrayNode();
        ArrayNode values = mapper.createArrayNode();
        ids.forEach(values::add);
        filters.add(mapper.createObjectNode().set("ids", mapper.createObjectNode().set("values", values)));
        filters.addAll(compileConditions(where));
        body.set("query", bool(filters));

        JsonNode response = client.expectSuccess(index, "POST", "/" + index + "/_search", body);
        Set<String> found = new LinkedHashSet<>();
        response.path("hits").path("hits").forEach(hit -> found.add(hit.path("_id").asText()));
        return found;
    }

    @Override
    protected void nativeInsert(String index, List<VectorRecord> batch) {
        StringBuilder ndjson = new StringBuilder();
        try {
            for (VectorRecord record : batch) {
                ObjectNode action = mapper.createObjectNode();
                action.set("create", mapper.createObjectNode().put("_index", index).put("_id", record.id()));
                ObjectNode source = mapper.createObjectNode();
                source.put("text", record.text());
                source.set("metadata", mapper.valueToTree(record.metadata()));
                source.set("embeddings", floatArray(record.embedding()));
                ndjson.append(mapper.writeValueAsString(action)).append('\n');
                ndjson.append(mapper.writeValueAsString(source)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize bulk request for " + index, e);
        }

        HttpResult result = client.sendNdjson("/_bulk", ndjson.toString());
        if (!result.isSuccessful()) {
            throw client.rejected(index, "POST", "/_bulk", result);
        }
        if (result.body().path("errors").asBoolean(false)) {
            int conflicts = 0;
            for (JsonNode item : result.body().path("items")) {
                JsonNode create = item.path("create");
                int status = create.path("status").asInt();
                if (status == 409) {
                    conflicts++;
                } else if (status == 404) {
                    throw new CollectionNotReadyException(index, "bulk create of " + create.path("_id").asText()
                            + " answered 404: " + create.path("error"));
                } else if (status < 200 || status >= 300) {
                    throw new BackendUnavailableException("Bulk create of " + create.path("_id").asText() + " into " + index
                            + " failed with " + status + ": " + create.path("error"));
                }
            }
            log.debug("elasticsearch.bulk.existing index={} skipped={}", index, conflicts);
        }
        client.expectSuccess(index, "POST", "/" + index + "/_refresh", null);
    }

    @Override
    protected List<QueryMatch> nativeSearch(String index, float[] vector, int nResults, Filter where) {
        int dimension = embedder().vectorDimension();
        if (vector.length != dimension) {
            throw new DimensionMismatchException(index, dimension, vector.length);
        }
        ObjectNode script = mapper.createObjectNode();
        script.put("source", SCORE_SCRIPT);
        script.set("params", mapper.createObjectNode().set("query_vector", floatArray(vector)));
        ObjectNode scriptScore = mapper.createObjectNode();
        scriptScore.set("query", bool(compileConditions(where)));
        scriptScore.set("script", script);

        ObjectNode body = mapper.createObjectNode();
        body.put("size", nResults);
        body.set("_source", mapper.createArrayNode().add("text").add("metadata"));
        body.set("query", mapper.createObjectNode().set("script_score", scriptScore));

        HttpResult result = client.send("POST", "/" + index + "/_search", body);
        if (result.code() == 400) {
            Matcher matcher = DIMENSION_ERROR.matcher(result.raw());
            if (matcher.find()) {
                throw new DimensionMismatchException(index, Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
            }
        }
        if (!result.isSuccessful()) {
            throw client.rejected(index, "POST", "/" + index + "/_search", result);
        }
        List<QueryMatch> matches = new ArrayList<>();
        for (JsonNode hit : result.body().path("hits").path("hits")) {
            JsonNode metadata = hit.path("_source").path("metadata");
            matches.add(new QueryMatch(
                    hit.path("_id").asText(),
                    hit.path("_source").path("text").asText(),
                    metadata.isObject() ? mapper.convertValue(metadata, METADATA_TYPE) : Map.of(),
                    2.0 - hit.path("_score").asDouble()));
        }
        return matches;
    }

    @Override
    protected long nativeCount(String index) {
        return client.expectSuccess(index, "GET", "/" + index + "/_count", null).path("count").asLong();
    }

    @Override
    protected void nativeDelete(String index, Filter where) {
        ObjectNode body = mapper.createObjectNode();
        body.set("query", bool(compileConditions(where)));
        JsonNode response = client.expectSuccess(index, "POST", "/" + index + "/_delete_by_query?refresh=true", body);
        log.debug("elasticsearch.delete index={} deleted={}", index, response.path("deleted").asLong());
    }

    @Override
    protected AbstractVectorStore newView(StoreOptions viewOptions) {
        return new ElasticsearchVectorStore(client, viewOptions);
    }

    ObjectNode indexSettings(int dimension) {
        ObjectNode keyword = mapper.createObjectNode();
        keyword.put("path_match", "metadata.*");
        keyword.put("match_mapping_type", "string");
        keyword.set("mapping", mapper.createObjectNode().put("type", "keyword"));

        ObjectNode properties = mapper.createObjectNode();
        properties.set("text", mapper.createObjectNode().put("type", "text"));
        properties.set("metadata", mapper.createObjectNode().put("type", "object"));
        properties.set("embeddings", mapper.createObjectNode()
                .put("type", "dense_vector")
                .put("dims", dimension)
                .put("index", false));

        ObjectNode mappings = mapper.createObjectNode();
        mappings.set("dynamic_templates", mapper.createArrayNode().add(mapper.createObjectNode().set("metadata_strings", keyword)));
        mappings.set("properties", properties);
        return (ObjectNode) mapper.createObjectNode().set("mappings", mappings);
    }

    ArrayNode compileConditions(Filter where) {
        ArrayNode out = mapper.createArrayNode();
        for (Filter condition : where.conditions()) {
            if (condition instanceof Filter.Eq eq) {
                out.add(mapper.createObjectNode().set("term",
                        mapper.createObjectNode().set("metadata." + eq.field(), mapper.valueToTree(eq.value()))));
            } else if (condition instanceof Filter.In in) {
                out.add(mapper.createObjectNode().set("terms",
                        mapper.createObjectNode().set("metadata." + in.field(), mapper.valueToTree(in.values()))));
            } else {
                throw new IllegalArgumentException("Unsupported filter " + condition);
            }
        }
        return out;
    }

    private ObjectNode bool(ArrayNode filters) {
        return (ObjectNode) mapper.createObjectNode().set("bool", mapper.createObjectNode().set("filter", filters));
    }

    private ArrayNode floatArray(float[] vector) {
        ArrayNode array = mapper.createArrayNode();
        for (float value : vector) {
            array.add(value);
        }
        return array;
    }
}
