package com.ragkit.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragkit.store.StoreOptions;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IngestConfig ingest = new IngestConfig();
    private QueryConfig query = new QueryConfig();

    /**
     * Reads a YAML config file; a missing file yields the defaults.
     */
    public static AppConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(path.toFile(), AppConfig.class);
        return config == null ? new AppConfig() : config;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String provider = "local";
        private String collectionName = StoreOptions.DEFAULT_COLLECTION;
        private boolean allowReset = false;
        private int batchSize = StoreOptions.DEFAULT_BATCH_SIZE;
        private int workers = 1;
        private LocalConfig local = new LocalConfig();
        private EndpointConfig elasticsearch = new EndpointConfig("http://localhost:9200");
        private EndpointConfig qdrant = new EndpointConfig("http://localhost:6333");

        public StoreOptions toOptions() {
            return new StoreOptions(collectionName, allowReset, batchSize, workers);
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName == null ? StoreOptions.DEFAULT_COLLECTION : collectionName;
        }

        public boolean isAllowReset() {
            return allowReset;
        }

        public void setAllowReset(boolean allowReset) {
            this.allowReset = allowReset;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public LocalConfig getLocal() {
            return local;
        }

        public void setLocal(LocalConfig local) {
            this.local = local == null ? new LocalConfig() : local;
        }

        public EndpointConfig getElasticsearch() {
            return elasticsearch;
        }

        public void setElasticsearch(EndpointConfig elasticsearch) {
            this.elasticsearch = elasticsearch == null ? new EndpointConfig("http://localhost:9200") : elasticsearch;
        }

        public EndpointConfig getQdrant() {
            return qdrant;
        }

        public void setQdrant(EndpointConfig qdrant) {
            this.qdrant = qdrant == null ? new EndpointConfig("http://localhost:6333") : qdrant;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocalConfig {
        private String directory = "db";
        private String metric = "cosine";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric == null ? "cosine" : metric;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EndpointConfig {
        private String url;
        private String apiKey;

        public EndpointConfig() {
        }

        public EndpointConfig(String url) {
            this.url = url;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private int dimension = 384;
        private String url;
        private String model = "text-embedding-3-small";
        private String apiKey;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private String pipelineId = "default";
        private String ledgerPath = ".ragkit/data-sources.json";
        private int chunkSize = 1000;
        private int chunkOverlap = 0;
        private int workers = 1;

        public String getPipelineId() {
            return pipelineId;
        }

        public void setPipelineId(String pipelineId) {
            this.pipelineId = pipelineId == null ? "default" : pipelineId;
        }

        public String getLedgerPath() {
            return ledgerPath;
        }

        public void setLedgerPath(String ledgerPath) {
            this.ledgerPath = ledgerPath;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int defaultResults = 3;
        private String promptTemplate;

        public int getDefaultResults() {
            return defaultResults;
        }

        public void setDefaultResults(int defaultResults) {
            this.defaultResults = defaultResults;
        }

        public String getPromptTemplate() {
            return promptTemplate;
        }

        public void setPromptTemplate(String promptTemplate) {
            this.promptTemplate = promptTemplate;
        }
    }
}
