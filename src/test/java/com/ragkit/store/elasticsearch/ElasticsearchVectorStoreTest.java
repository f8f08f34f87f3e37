package com.ragkit.store.elasticsearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.ragkit.embed.RecordingEmbedder;
import com.ragkit.store.BackendUnavailableException;
import com.ragkit.store.BatchPartialFailureException;
import com.ragkit.store.Citation;
import com.ragkit.store.CollectionNotReadyException;
import com.ragkit.store.DimensionMismatchException;
import com.ragkit.store.Filter;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.QueryRequest;
import com.ragkit.store.ResetDisabledException;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.VectorStore;

class ElasticsearchVectorStoreTest {
    private static final String INDEX = "embedchain_store-16";

    private FakeElasticsearch fake;
    private RecordingEmbedder embedder;

    @BeforeEach
    void setUp() {
        fake = new FakeElasticsearch();
        embedder = new RecordingEmbedder(16);
    }

    private ElasticsearchVectorStore store(StoreOptions options) {
        ElasticsearchVectorStore store = ElasticsearchVectorStore.connect(fake.client(), "http://es.test:9200", "secret", options);
        store.initialize(embedder);
        return store;
    }

    @Test
    void shouldCreateIndexWithDenseVectorMappingOnInitialize() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());

        assertEquals(INDEX, store.physicalCollectionName());
        assertTrue(fake.hasIndex(INDEX));
        assertEquals(16, fake.dims(INDEX));
        assertEquals(1, fake.callCount("PUT /" + INDEX));

        store(StoreOptions.defaults());
        assertEquals(1, fake.callCount("PUT /" + INDEX));
    }

    @Test
    void shouldWriteTwoHundredFiftyRecordsInThreeBulkRequests() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        List<String> ids = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> metadatas = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            ids.add("doc-" + i);
            texts.add("record number " + i);
            metadatas.add(Map.of("url", "memory://" + i, "doc_id", "d" + i));
        }

        store.add(ids, texts, metadatas);

        assertEquals(3, fake.callCount("POST /_bulk"));
        assertEquals(3, fake.refreshes(INDEX));
        assertEquals(List.of(100, 100, 50), embedder.batchSizes());
        assertEquals(250, store.count());
    }

    @Test
    void shouldTreatExistingIdsAsNoOps() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        store.add(List.of("a", "b"), List.of("alpha", "beta"), List.of(Map.of(), Map.of()));
        store.add(List.of("b", "c"), List.of("beta changed", "gamma"), List.of(Map.of(), Map.of()));

        assertEquals(3, store.count());
        List<String> texts = store.query(QueryRequest.ofText("beta", 3));
        assertTrue(texts.contains("beta"));
        assertFalse(texts.contains("beta changed"));
    }

    @Test
    void shouldAndAllWhereKeys() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        store.add(
                List.of("1", "2", "3"),
                List.of("red small", "red large", "blue small"),
                List.of(Map.of("color", "red", "size", "s"), Map.of("color", "red", "size", "l"), Map.of("color", "blue", "size", "s")));

        List<String> hits = store.query(QueryRequest.ofText("small", 3).where(Map.of("color", "red", "size", "s")));

        assertEquals(List.of("red small"), hits);
        assertEquals(2, store.query(QueryRequest.ofText("small", 3).where(Map.of("color", List.of("red", "blue"), "size", "s"))).size());
    }

    @Test
    void shouldReturnCitationsAndDistanceFromScore() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        store.add(
                List.of("p"),
                List.of("Paris is the capital of France"),
                List.of(Map.of("url", "https://example.org/france", "doc_id", "france-doc")));

        List<Citation> citations = store.queryWithCitations(QueryRequest.ofText("Paris is the capital of France", 1));
        List<QueryMatch> matches = store.search(QueryRequest.ofText("Paris is the capital of France", 1));

        assertEquals(new Citation("Paris is the capital of France", "https://example.org/france", "france-doc"), citations.get(0));
        assertEquals(0.0, matches.get(0).distance(), 1e-6);
    }

    @Test
    void shouldFindExistingIdsWithFilter() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        store.add(List.of("a", "b"), List.of("alpha", "beta"), List.of(Map.of("doc_id", "x"), Map.of("doc_id", "y")));

        assertEquals(List.of("a", "b"), new ArrayList<>(store.getExisting(List.of("a", "b", "zzz"))));
        assertEquals(List.of("b"), new ArrayList<>(store.getExisting(List.of("a", "b"), Filter.eq("doc_id", "y"), null)));
        assertTrue(store.getExisting(List.of()).isEmpty());
    }

    @Test
    void shouldDeleteByFilter() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        store.add(List.of("a", "b"), List.of("alpha", "beta"), List.of(Map.of("doc_id", "x"), Map.of("doc_id", "y")));

        store.deleteWhere(Map.of("doc_id", "x"));

        assertEquals(1, store.count());
        assertEquals(1, fake.callCount("POST /" + INDEX + "/_delete_by_query"));
    }

    @Test
    void shouldResetOnlyWhenAllowed() {
        ElasticsearchVectorStore locked = store(StoreOptions.defaults());
        locked.add(List.of("a"), List.of("alpha"), List.of(Map.of()));

        assertThrows(ResetDisabledException.class, locked::reset);
        assertEquals(1, locked.count());
        assertEquals(0, fake.callCount("DELETE /" + INDEX));

        ElasticsearchVectorStore open = store(StoreOptions.defaults().withAllowReset(true));
        open.reset();
        assertEquals(0, open.count());
        assertTrue(fake.hasIndex(INDEX));
    }

    @Test
    void shouldRejectQueryVectorOfOtherDimension() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());

        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
                () -> store.search(QueryRequest.ofVector(new float[4], 1)));

        assertEquals(16, error.expectedDimension());
        assertEquals(4, error.actualDimension());
    }

    @Test
    void shouldReportFailedBulkBatch() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults().withBatchSize(2));
        fake.failBulkCall(1);

        BatchPartialFailureException error = assertThrows(BatchPartialFailureException.class, () -> store.add(
                List.of("1", "2", "3", "4", "5"),
                List.of("one", "two", "three", "four", "five"),
                null));

        assertEquals(List.of(0), error.succeededBatches());
        assertEquals(List.of(1), error.failedBatches());
        assertEquals(List.of(2), error.skippedBatches());
        assertTrue(error.getCause() instanceof BackendUnavailableException);
        assertEquals(2, store.count());
    }

    @Test
    void shouldReportIndexDeletedElsewhereAsNotReady() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        fake.deleteIndexBehindStore(INDEX);

        CollectionNotReadyException error = assertThrows(CollectionNotReadyException.class, store::count);

        assertTrue(error.getMessage().contains(INDEX));
        assertThrows(CollectionNotReadyException.class, () -> store.query(QueryRequest.ofText("anything", 1)));
    }

    @Test
    void shouldReportOtherRejectionsAsBackendUnavailableWithStatus() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());
        fake.answerNextCall(400, "illegal_argument_exception");

        BackendUnavailableException error = assertThrows(BackendUnavailableException.class,
                () -> store.deleteWhere(Map.of("doc_id", "x")));

        assertTrue(error.getMessage().contains("400"));
    }

    @Test
    void shouldTypeBulkItemFailures() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());

        fake.failBulkItems(404, "index_not_found_exception");
        BatchPartialFailureException missing = assertThrows(BatchPartialFailureException.class,
                () -> store.add(List.of("a"), List.of("alpha"), null));
        assertTrue(missing.getCause() instanceof CollectionNotReadyException);

        fake.failBulkItems(400, "mapper_parsing_exception");
        BatchPartialFailureException rejected = assertThrows(BatchPartialFailureException.class,
                () -> store.add(List.of("b"), List.of("beta"), null));
        assertTrue(rejected.getCause() instanceof BackendUnavailableException);
        assertTrue(rejected.getCause().getMessage().contains("mapper_parsing_exception"));
    }

    @Test
    void shouldCompileFilterIntoTermQueries() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());

        ArrayNode compiled = store.compileConditions(Filter.fromWhere(Map.of("a", 1, "b", List.of("x", "y"))));

        assertEquals(2, compiled.size());
        assertEquals(1, compiled.get(0).path("term").path("metadata.a").asInt());
        assertEquals("y", compiled.get(1).path("terms").path("metadata.b").get(1).asText());
        assertFalse(compiled.get(0).has("terms"));
    }

    @Test
    void shouldShareClientInCollectionView() {
        ElasticsearchVectorStore store = store(StoreOptions.defaults());

        VectorStore view = store.withCollection("Other Docs");
        view.add(List.of("a"), List.of("alpha"), List.of(Map.of()));

        assertEquals("embedchain_store", store.collectionName());
        assertEquals("other-docs-16", view.physicalCollectionName());
        assertEquals(0, store.count());
        assertEquals(1, view.count());
    }
}
