package com.ragkit.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragkit.embed.RecordingEmbedder;
import com.ragkit.store.Citation;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.QueryRequest;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.local.LocalVectorEngine;
import com.ragkit.store.local.LocalVectorStore;

import okhttp3.OkHttpClient;

class IngestionPipelineTest {

    @TempDir
    Path tempDir;

    private RecordingEmbedder embedder;
    private LocalVectorStore store;
    private SourceLedger ledger;

    @BeforeEach
    void setUp() {
        embedder = new RecordingEmbedder(32);
        store = new LocalVectorStore(LocalVectorEngine.inMemory(), StoreOptions.defaults());
        store.initialize(embedder);
        ledger = SourceLedger.inMemory();
    }

    private IngestionPipeline pipeline(int chunkSize, int workers) {
        return new IngestionPipeline(store, IngestionPipeline.defaultLoaders(new OkHttpClient()),
                new TextChunker(chunkSize, 0), ledger, "test", workers);
    }

    @Test
    void shouldAddNothingWhenSourceIsIngestedAgain() throws Exception {
        IngestionPipeline pipeline = pipeline(20, 1);
        Source source = Source.text("Paris is the capital of France. Berlin is the capital of Germany.");

        SourceOutcome first = pipeline.ingest(source);
        int embeddedAfterFirst = embedder.embeddedTexts();
        SourceOutcome second = pipeline.ingest(source);

        assertEquals(SourceOutcome.Status.ADDED, first.status());
        assertTrue(first.added() > 1);
        assertEquals(SourceOutcome.Status.UNCHANGED, second.status());
        assertEquals(0, second.added());
        assertEquals(first.added(), store.count());
        assertEquals(embeddedAfterFirst, embedder.embeddedTexts());
        assertEquals(1, pipeline.dataSources().size());
    }

    @Test
    void shouldCollapseRepeatedChunksOfOneSource() throws Exception {
        SourceOutcome outcome = pipeline(5, 1).ingest(Source.text("same same same"));

        assertEquals(1, outcome.chunks());
        assertEquals(1, store.count());
    }

    @Test
    void shouldWriteReservedMetadataForCitations() throws Exception {
        Path file = tempDir.resolve("france.txt");
        Files.writeString(file, "Paris is the capital of France.");
        IngestionPipeline pipeline = pipeline(1000, 1);

        SourceOutcome outcome = pipeline.ingest(Source.file(file.toString()).withMetadata(Map.of("team", "geo")));

        List<QueryMatch> matches = store.search(QueryRequest.ofText("capital of France", 1));
        Map<String, Object> metadata = matches.get(0).metadata();
        assertEquals(file.toString(), metadata.get("url"));
        assertEquals(outcome.documentId(), metadata.get("doc_id"));
        assertEquals(outcome.documentId(), metadata.get("hash"));
        assertEquals("file", metadata.get("data_type"));
        assertEquals(0, ((Number) metadata.get("chunk_index")).intValue());
        assertEquals("geo", metadata.get("team"));
        assertEquals("france.txt", metadata.get("file_name"));

        Citation citation = store.queryWithCitations(QueryRequest.ofText("capital of France", 1)).get(0);
        assertEquals(file.toString(), citation.source());
        assertEquals(DocumentIds.documentId("Paris is the capital of France.", file.toString()), citation.documentId());
    }

    @Test
    void shouldIsolateFailingSources() {
        IngestionPipeline pipeline = pipeline(1000, 1);

        IngestionReport report = pipeline.ingest(List.of(
                Source.text("first document"),
                Source.file(tempDir.resolve("missing.txt").toString()),
                Source.text("second document")));

        assertEquals(3, report.outcomes().size());
        assertEquals(1, report.failedSources());
        assertEquals(SourceOutcome.Status.FAILED, report.outcomes().get(1).status());
        assertNotNull(report.outcomes().get(1).error());
        assertEquals(2, report.addedRecords());
        assertEquals(2, store.count());
    }

    @Test
    void shouldIngestSourcesOnWorkerPool() {
        IngestionPipeline pipeline = pipeline(1000, 4);

        IngestionReport report = pipeline.ingest(List.of(
                Source.text("one"), Source.text("two"), Source.text("three"), Source.text("four"), Source.text("five")));

        assertFalse(report.hasFailures());
        assertEquals(5, report.addedRecords());
        assertEquals("three", report.outcomes().get(2).source().value());
        assertEquals(5, store.count());
        assertEquals(5, pipeline.dataSources().size());
    }

    @Test
    void shouldDeleteSourceChunksAndLedgerEntry() throws Exception {
        IngestionPipeline pipeline = pipeline(10, 1);
        Source keep = Source.text("keep this text around");
        Source drop = Source.text("drop this other text now");
        pipeline.ingest(keep);
        pipeline.ingest(drop);
        long before = store.count();
        int dropChunks = pipeline.ingest(drop).chunks();

        assertTrue(pipeline.delete(drop));

        assertEquals(before - dropChunks, store.count());
        assertEquals(1, pipeline.dataSources().size());
        assertEquals("keep this text around", pipeline.dataSources().get(0).sourceValue());
        assertFalse(pipeline.delete(Source.text("never ingested")));
    }

    @Test
    void shouldReportEmptySourcesWithoutWriting() throws Exception {
        SourceOutcome outcome = pipeline(100, 1).ingest(Source.file(Files.writeString(tempDir.resolve("blank.txt"), "  \n").toString()));

        assertEquals(SourceOutcome.Status.EMPTY, outcome.status());
        assertEquals(0, store.count());
        assertTrue(ledger.sources("test").isEmpty());
    }
}
