package com.ragkit.store;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragkit.embed.Embedder;

/**
 * Lifecycle, batching, embedding and error translation shared by all adapters. Subclasses only
 * talk to their backend through the {@code native*} hooks, each of which addresses one physical
 * collection and at most one batch.
 *
 * <p>Locks are per physical collection and shared with {@link #withCollection} views. Data
 * operations hold the read lock and {@link #reset()} holds the write lock, so calls made through
 * any of them while a reset is in progress wait for the recreated collection.
 */
public abstract class AbstractVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractVectorStore.class);

    protected final StoreOptions options;
    private final BatchRunner batchRunner;
    private CollectionLocks locks = new CollectionLocks();
    private volatile StoreState state = StoreState.CONNECTED;
    private volatile Embedder embedder;
    private volatile String collectionName;

    protected AbstractVectorStore(StoreOptions options) {
        this.options = options;
        this.batchRunner = new BatchRunner(options.batchSize(), options.workers());
        this.collectionName = options.collectionName();
    }

    protected abstract CollectionNames.Style nameStyle();

    protected abstract void nativeEnsureCollection(String collection, int dimension);

    protected abstract void nativeDropCollection(String collection);

    protected abstract Set<String> nativeExisting(String collection, List<String> ids, Filter where);

    /**
     * Writes one batch. Records whose id already exists must be left untouched.
     */
    protected abstract void nativeInsert(String collection, List<VectorRecord> batch);

    protected abstract List<QueryMatch> nativeSearch(String collection, float[] vector, int nResults, Filter where);

    protected abstract long nativeCount(String collection);

    protected abstract void nativeDelete(String collection, Filter where);

    /**
     * A new store of the same backend sharing this store's client.
     */
    protected abstract AbstractVectorStore newView(StoreOptions viewOptions);

    @Override
    public void initialize(Embedder embedder) {
        if (embedder == null) {
            throw new EmbedderRequiredException();
        }
        String physical = CollectionNames.physicalName(collectionName, embedder.vectorDimension(), nameStyle());
        ReentrantReadWriteLock lock = locks.forCollection(physical);
        lock.writeLock().lock();
        try {
            translate("initialize", () -> {
                nativeEnsureCollection(physical, embedder.vectorDimension());
                return null;
            });
            this.embedder = embedder;
            state = StoreState.READY;
            log.info("store.ready backend={} collection={} embedder={}", backendName(), physical, embedder.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StoreState state() {
        return state;
    }

    @Override
    public Set<String> getExisting(List<String> ids, Filter where, Integer limit) {
        return readLocked("getExisting", physical -> {
            if (ids == null || ids.isEmpty()) {
                return Set.of();
            }
            Filter filter = where == null ? Filter.all() : where;
            List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
            Set<String> found = translate("getExisting",
                    () -> batchRunner.collect(distinct, batch -> nativeExisting(physical, batch, filter)));
            Set<String> ordered = new LinkedHashSet<>();
            for (String id : distinct) {
                if (found.contains(id)) {
                    ordered.add(id);
                }
                if (limit != null && ordered.size() >= limit) {
                    break;
                }
            }
            return ordered;
        });
    }

    @Override
    public void add(List<String> ids, List<String> texts, List<Map<String, Object>> metadatas, List<float[]> embeddings) {
        validateSizes(ids, texts, metadatas, embeddings);
        readLocked("add", physical -> {
            int dimension = embedder.vectorDimension();
            List<VectorRecord> records = new ArrayList<>(ids.size());
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < ids.size(); i++) {
                String id = ids.get(i);
                if (!seen.add(id)) {
                    log.warn("store.add.duplicate collection={} id={}", physical, id);
                    continue;
                }
                float[] embedding = embeddings == null ? null : embeddings.get(i);
                if (embedding != null && embedding.length != dimension) {
                    throw new DimensionMismatchException(physical, dimension, embedding.length);
                }
                Map<String, Object> metadata = metadatas == null || metadatas.get(i) == null ? Map.of() : metadatas.get(i);
                records.add(new VectorRecord(id, texts.get(i), metadata, embedding));
            }
            int batches = batchRunner.write(records, batch -> insertBatch(physical, dimension, batch));
            log.debug("store.add collection={} records={} batches={}", physical, records.size(), batches);
            return null;
        });
    }

    @Override
    public List<QueryMatch> search(QueryRequest request) {
        return readLocked("query", physical -> translate("query", () -> {
            float[] vector = request.hasVector() ? request.vector() : embedder.embed(request.text());
            return nativeSearch(physical, vector, request.nResults(), request.where());
        }));
    }

    @Override
    public List<String> query(QueryRequest request) {
        return search(request).stream().map(QueryMatch::text).toList();
    }

    @Override
    public List<Citation> queryWithCitations(QueryRequest request) {
        List<Citation> citations = new ArrayList<>();
        for (QueryMatch match : search(request)) {
            Object url = match.metadata().get(MetadataKeys.URL);
            if (url == null) {
                throw new MissingCitationMetadataException(match.id(), MetadataKeys.URL);
            }
            Object docId = match.metadata().get(MetadataKeys.DOC_ID);
            if (docId == null) {
                throw new MissingCitationMetadataException(match.id(), MetadataKeys.DOC_ID);
            }
            citations.add(new Citation(match.text(), url.toString(), docId.toString()));
        }
        return citations;
    }

    @Override
    public long count() {
        return readLocked("count", physical -> translate("count", () -> nativeCount(physical)));
    }

    @Override
    public void deleteWhere(Filter where) {
        if (where == null || where.isEmpty()) {
            throw new IllegalArgumentException("deleteWhere needs a non-empty filter; use reset() to clear a collection");
        }
        readLocked("delete", physical -> {
            translate("delete", () -> {
                nativeDelete(physical, where);
                return null;
            });
            log.info("store.delete collection={} filter={}", physical, where);
            return null;
        });
    }

    @Override
    public void reset() {
        if (!options.allowReset()) {
            throw new ResetDisabledException(collectionName);
        }
        // a BROKEN store may be reset again to recover
        Embedder current = embedder;
        if (current == null) {
            throw new NotReadyException("reset");
        }
        String physical = CollectionNames.physicalName(collectionName, current.vectorDimension(), nameStyle());
        ReentrantReadWriteLock lock = locks.forCollection(physical);
        lock.writeLock().lock();
        try {
            state = StoreState.RESETTING;
            log.warn("store.reset collection={}", physical);
            try {
                translate("reset", () -> {
                    nativeDropCollection(physical);
                    nativeEnsureCollection(physical, current.vectorDimension());
                    return null;
                });
                state = StoreState.READY;
            } catch (RuntimeException e) {
                state = StoreState.BROKEN;
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setCollectionName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        Embedder current = embedder;
        if (current == null) {
            collectionName = name;
            return;
        }
        String physical = CollectionNames.physicalName(name, current.vectorDimension(), nameStyle());
        ReentrantReadWriteLock lock = locks.forCollection(physical);
        lock.writeLock().lock();
        try {
            translate("setCollectionName", () -> {
                nativeEnsureCollection(physical, current.vectorDimension());
                return null;
            });
            state = StoreState.READY;
            collectionName = name;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String collectionName() {
        return collectionName;
    }

    @Override
    public String physicalCollectionName() {
        requireInitialized("physicalCollectionName");
        return CollectionNames.physicalName(collectionName, embedder.vectorDimension(), nameStyle());
    }

    @Override
    public VectorStore withCollection(String name) {
        AbstractVectorStore view = newView(options.withCollectionName(name));
        view.locks = locks;
        if (embedder != null) {
            view.initialize(embedder);
        }
        return view;
    }

    @Override
    public void close() {
    }

    protected Embedder embedder() {
        return embedder;
    }

    protected String backendName() {
        return getClass().getSimpleName();
    }

    private void insertBatch(String physical, int dimension, List<VectorRecord> batch) {
        List<VectorRecord> ready = batch;
        if (batch.stream().anyMatch(record -> record.embedding() == null)) {
            List<float[]> vectors = embedder.embed(batch.stream().map(VectorRecord::text).toList());
            ready = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                VectorRecord record = batch.get(i);
                float[] vector = record.embedding() != null ? record.embedding() : vectors.get(i);
                if (vector.length != dimension) {
                    throw new DimensionMismatchException(physical, dimension, vector.length);
                }
                ready.add(new VectorRecord(record.id(), record.text(), record.metadata(), vector));
            }
        }
        List<VectorRecord> toWrite = ready;
        translate("add", () -> {
            nativeInsert(physical, toWrite);
            return null;
        });
    }

    private <T> T readLocked(String operation, Function<String, T> action) {
        Embedder current = embedder;
        if (current == null) {
            throw new NotReadyException(operation);
        }
        String physical = CollectionNames.physicalName(collectionName, current.vectorDimension(), nameStyle());
        ReentrantReadWriteLock lock = locks.forCollection(physical);
        lock.readLock().lock();
        try {
            requireInitialized(operation);
            return action.apply(physical);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void requireInitialized(String operation) {
        StoreState current = state;
        if (current == StoreState.UNINITIALIZED || current == StoreState.CONNECTED || embedder == null) {
            throw new NotReadyException(operation);
        }
        if (current != StoreState.READY) {
            throw new CollectionNotReadyException(collectionName, current);
        }
    }

    /**
     * Runs a native call and converts anything that is not already a store exception into a
     * {@link BackendUnavailableException}.
     */
    protected <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(backendName() + " failed during " + operation + ": " + e.getMessage(), e);
        }
    }

    private static void validateSizes(List<String> ids, List<String> texts, List<Map<String, Object>> metadatas, List<float[]> embeddings) {
        if (ids == null || texts == null) {
            throw new IllegalArgumentException("ids and texts are required");
        }
        if (ids.size() != texts.size()) {
            throw new IllegalArgumentException("ids and texts must have the same size: " + ids.size() + " != " + texts.size());
        }
        if (metadatas != null && metadatas.size() != ids.size()) {
            throw new IllegalArgumentException("metadatas must match ids in size: " + metadatas.size() + " != " + ids.size());
        }
        if (embeddings != null && embeddings.size() != ids.size()) {
            throw new IllegalArgumentException("embeddings must match ids in size: " + embeddings.size() + " != " + ids.size());
        }
    }
}
