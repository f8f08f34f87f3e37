package com.ragkit.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragkit.embed.Embedder;
import com.ragkit.embed.Embedders;
import com.ragkit.ingest.IngestionPipeline;
import com.ragkit.ingest.SourceLedger;
import com.ragkit.ingest.TextChunker;
import com.ragkit.query.QueryPipeline;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.VectorStore;
import com.ragkit.store.elasticsearch.ElasticsearchVectorStore;
import com.ragkit.store.local.DistanceMetric;
import com.ragkit.store.local.LocalVectorEngine;
import com.ragkit.store.local.LocalVectorStore;
import com.ragkit.store.qdrant.QdrantVectorStore;

import okhttp3.OkHttpClient;

/**
 * The embedder, the initialized store and both pipelines, wired from an {@link AppConfig}.
 */
public record RagComponents(Embedder embedder, VectorStore store, IngestionPipeline ingestion, QueryPipeline query)
        implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RagComponents.class);

    public static RagComponents fromConfig(AppConfig config, OkHttpClient httpClient) throws IOException {
        Embedder embedder = Embedders.create(config.getEmbedding(), httpClient);
        VectorStore store = createStore(config.getStore(), httpClient);
        store.initialize(embedder);

        AppConfig.IngestConfig ingest = config.getIngest();
        SourceLedger ledger = ingest.getLedgerPath() == null || ingest.getLedgerPath().isBlank()
                ? SourceLedger.inMemory()
                : SourceLedger.open(Path.of(ingest.getLedgerPath()));
        IngestionPipeline ingestion = new IngestionPipeline(
                store,
                IngestionPipeline.defaultLoaders(httpClient),
                new TextChunker(ingest.getChunkSize(), ingest.getChunkOverlap()),
                ledger,
                ingest.getPipelineId(),
                ingest.getWorkers());

        AppConfig.QueryConfig query = config.getQuery();
        QueryPipeline queryPipeline = query.getPromptTemplate() == null
                ? new QueryPipeline(store, query.getDefaultResults())
                : new QueryPipeline(store, query.getDefaultResults(), query.getPromptTemplate());
        return new RagComponents(embedder, store, ingestion, queryPipeline);
    }

    static VectorStore createStore(AppConfig.StoreConfig config, OkHttpClient httpClient) throws IOException {
        StoreOptions options = config.toOptions();
        String provider = config.getProvider() == null ? "local" : config.getProvider().toLowerCase(Locale.ROOT);
        log.info("store.create provider={} collection={}", provider, options.collectionName());
        return switch (provider) {
            case "local" -> new LocalVectorStore(openEngine(config.getLocal()), options, DistanceMetric.parse(config.getLocal().getMetric()));
            case "elasticsearch" -> ElasticsearchVectorStore.connect(
                    httpClient, config.getElasticsearch().getUrl(), config.getElasticsearch().getApiKey(), options);
            case "qdrant" -> QdrantVectorStore.connect(httpClient, config.getQdrant().getUrl(), config.getQdrant().getApiKey(), options);
            default -> throw new IllegalArgumentException("Unknown store provider: " + config.getProvider());
        };
    }

    private static LocalVectorEngine openEngine(AppConfig.LocalConfig local) throws IOException {
        if (local.getDirectory() == null || local.getDirectory().isBlank()) {
            return LocalVectorEngine.inMemory();
        }
        return LocalVectorEngine.open(Path.of(local.getDirectory()));
    }

    @Override
    public void close() {
        store.close();
    }
}
