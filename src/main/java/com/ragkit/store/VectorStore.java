package com.ragkit.store;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ragkit.embed.Embedder;

/**
 * Contract every vector database adapter implements.
 *
 * <p>Stores start in {@link StoreState#CONNECTED}: the client exists but no collection has been
 * touched. {@link #initialize(Embedder)} binds the embedder, and with it the vector dimension, and
 * creates the active collection. Every data method called before that fails with
 * {@link NotReadyException}.
 *
 * <p>The active collection set by {@link #setCollectionName(String)} is mutable instance state and
 * is not safe to change while other threads use the store. Use {@link #withCollection(String)} to
 * target another collection from concurrent code.
 */
public interface VectorStore extends AutoCloseable {

    void initialize(Embedder embedder);

    StoreState state();

    /**
     * Returns which of {@code ids} are already stored, optionally restricted by a metadata filter
     * and capped at {@code limit} entries (null for no cap).
     */
    Set<String> getExisting(List<String> ids, Filter where, Integer limit);

    default Set<String> getExisting(List<String> ids) {
        return getExisting(ids, Filter.all(), null);
    }

    /**
     * Inserts records, computing embeddings with the bound embedder. Ids that are already present
     * are left untouched.
     *
     * @throws BatchPartialFailureException when a batch fails; later batches are not sent
     */
    default void add(List<String> ids, List<String> texts, List<Map<String, Object>> metadatas) {
        add(ids, texts, metadatas, null);
    }

    /**
     * Inserts records with caller-supplied embeddings, or computed ones when {@code embeddings} is
     * null.
     */
    void add(List<String> ids, List<String> texts, List<Map<String, Object>> metadatas, List<float[]> embeddings);

    List<QueryMatch> search(QueryRequest request);

    List<String> query(QueryRequest request);

    /**
     * @throws MissingCitationMetadataException when a hit lacks {@code url} or {@code doc_id}
     */
    List<Citation> queryWithCitations(QueryRequest request);

    long count();

    /**
     * Deletes every record of the active collection matching a non-empty filter.
     */
    void deleteWhere(Filter where);

    default void deleteWhere(Map<String, ?> where) {
        deleteWhere(Filter.fromWhere(where));
    }

    /**
     * Drops the active collection and recreates it empty.
     *
     * @throws ResetDisabledException unless the store was configured with {@code allowReset}
     */
    void reset();

    void setCollectionName(String name);

    String collectionName();

    String physicalCollectionName();

    /**
     * A store sharing this store's client but bound to another collection. The active collection
     * of this store does not change.
     */
    VectorStore withCollection(String name);

    @Override
    void close();
}
