package com.ragkit.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragkit.store.MetadataKeys;
import com.ragkit.store.VectorStore;

import okhttp3.OkHttpClient;

/**
 * Loads sources, chunks them and writes the chunks that are not stored yet. Chunk ids are content
 * hashes, so ingesting the same source twice adds nothing the second time.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final VectorStore store;
    private final List<Loader> loaders;
    private final TextChunker chunker;
    private final SourceLedger ledger;
    private final String pipelineId;
    private final int workers;
    private final ObjectMapper mapper = new ObjectMapper();

    public IngestionPipeline(VectorStore store, List<Loader> loaders, TextChunker chunker, SourceLedger ledger, String pipelineId, int workers) {
        this.store = store;
        this.loaders = List.copyOf(loaders);
        this.chunker = chunker;
        this.ledger = ledger;
        this.pipelineId = pipelineId;
        this.workers = Math.max(1, workers);
    }

    public static List<Loader> defaultLoaders(OkHttpClient httpClient) {
        return List.of(new TextLoader(), new FileLoader(), new WebPageLoader(httpClient));
    }

    /**
     * Ingests one source. Loader and store failures propagate to the caller.
     */
    public SourceOutcome ingest(Source source) throws IOException {
        LoadedDocument document = loaderFor(source.type()).load(source);
        String documentId = DocumentIds.documentId(document.content(), source.value());
        List<String> chunks = chunker.chunk(document.content());
        if (chunks.isEmpty()) {
            log.warn("ingest.source.empty type={} source={}", source.type().label(), source.value());
            return new SourceOutcome(source, SourceOutcome.Status.EMPTY, documentId, 0, 0, null);
        }

        Map<String, Integer> indexById = new LinkedHashMap<>();
        for (int i = 0; i < chunks.size(); i++) {
            indexById.putIfAbsent(DocumentIds.chunkId(chunks.get(i), source.value()), i);
        }
        List<String> ids = new ArrayList<>(indexById.keySet());
        Set<String> existing = store.getExisting(ids);

        List<String> newIds = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> metadatas = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : indexById.entrySet()) {
            if (existing.contains(entry.getKey())) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
            metadata.putAll(source.metadata());
            metadata.put(MetadataKeys.URL, source.value());
            metadata.put(MetadataKeys.DOC_ID, documentId);
            metadata.put(MetadataKeys.HASH, documentId);
            metadata.put(MetadataKeys.DATA_TYPE, source.type().label());
            metadata.put(MetadataKeys.CHUNK_INDEX, entry.getValue());
            newIds.add(entry.getKey());
            texts.add(chunks.get(entry.getValue()));
            metadatas.add(metadata);
        }

        if (!newIds.isEmpty()) {
            store.add(newIds, texts, metadatas);
        }
        if (!existing.isEmpty()) {
            log.info("ingest.source.skipped type={} source={} existing={}", source.type().label(), source.value(), existing.size());
        }

        Map<String, Object> ledgerMetadata = new LinkedHashMap<>(document.metadata());
        ledgerMetadata.putAll(source.metadata());
        ledger.record(new LedgerEntry(pipelineId, documentId, source.type().label(), source.value(),
                mapper.writeValueAsString(ledgerMetadata), false));

        SourceOutcome.Status status = newIds.isEmpty() ? SourceOutcome.Status.UNCHANGED : SourceOutcome.Status.ADDED;
        log.info("ingest.source type={} source={} chunks={} added={}", source.type().label(), source.value(), ids.size(), newIds.size());
        return new SourceOutcome(source, status, documentId, ids.size(), newIds.size(), null);
    }

    /**
     * Ingests every source. A failing source is reported in its outcome and does not stop the
     * others.
     */
    public IngestionReport ingest(List<Source> sources) {
        if (workers == 1 || sources.size() < 2) {
            List<SourceOutcome> outcomes = new ArrayList<>();
            for (Source source : sources) {
                outcomes.add(ingestIsolated(source));
            }
            return new IngestionReport(outcomes);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, sources.size()));
        try {
            List<Future<SourceOutcome>> futures = new ArrayList<>();
            for (Source source : sources) {
                futures.add(executor.submit(() -> ingestIsolated(source)));
            }
            List<SourceOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(SourceOutcome.failed(sources.get(i), e));
                }
            }
            return new IngestionReport(outcomes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ingesting sources", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Removes every chunk of a source from the store and forgets it in the ledger.
     *
     * @return true when the ledger knew the source
     */
    public boolean delete(Source source) throws IOException {
        List<String> hashes = ledger.sources(pipelineId).stream()
                .filter(entry -> entry.sourceType().equals(source.type().label()))
                .filter(entry -> entry.sourceValue().equals(source.value()))
                .map(LedgerEntry::contentHash)
                .toList();
        if (hashes.isEmpty()) {
            LoadedDocument document = loaderFor(source.type()).load(source);
            hashes = List.of(DocumentIds.documentId(document.content(), source.value()));
        }
        boolean removed = false;
        for (String hash : hashes) {
            store.deleteWhere(Map.of(MetadataKeys.DOC_ID, hash));
            removed |= ledger.remove(pipelineId, hash);
            log.info("ingest.source.deleted type={} source={} hash={}", source.type().label(), source.value(), hash);
        }
        return removed;
    }

    public List<LedgerEntry> dataSources() {
        return ledger.sources(pipelineId);
    }

    public String pipelineId() {
        return pipelineId;
    }

    private SourceOutcome ingestIsolated(Source source) {
        try {
            return ingest(source);
        } catch (IOException | RuntimeException e) {
            log.error("ingest.source.failed type={} source={}", source.type().label(), source.value(), e);
            return SourceOutcome.failed(source, e);
        }
    }

    private Loader loaderFor(SourceType type) {
        for (Loader loader : loaders) {
            if (loader.supports(type)) {
                return loader;
            }
        }
        throw new IllegalArgumentException("No loader registered for " + type.label());
    }
}
