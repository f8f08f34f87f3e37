package com.ragkit.store.local;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import com.ragkit.store.AbstractVectorStore;
import com.ragkit.store.CollectionNames;
import com.ragkit.store.CollectionNotReadyException;
import com.ragkit.store.DimensionMismatchException;
import com.ragkit.store.Filter;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.StoreOptions;
import com.ragkit.store.VectorRecord;

/**
 * Document-store adapter over a {@link LocalVectorEngine}. Filters are compiled into the engine's
 * where trees: one condition as-is, several wrapped in an explicit {@code $and}.
 */
public class LocalVectorStore extends AbstractVectorStore {
    private final LocalVectorEngine engine;
    private final DistanceMetric metric;

    public LocalVectorStore(LocalVectorEngine engine, StoreOptions options) {
        this(engine, options, DistanceMetric.COSINE);
    }

    public LocalVectorStore(LocalVectorEngine engine, StoreOptions options, DistanceMetric metric) {
        super(options);
        this.engine = engine;
        this.metric = metric;
    }

    @Override
    protected CollectionNames.Style nameStyle() {
        return CollectionNames.Style.UNDERSCORES_ALLOWED;
    }

    @Override
    protected void nativeEnsureCollection(String collection, int dimension) {
        onEngine(collection, () -> {
            engine.getOrCreateCollection(collection, dimension, metric);
            return null;
        });
    }

    @Override
    protected void nativeDropCollection(String collection) {
        engine.deleteCollection(collection);
    }

    @Override
    protected Set<String> nativeExisting(String collection, List<String> ids, Filter where) {
        return onEngine(collection, () -> new LinkedHashSet<>(engine.get(collection, ids, compile(where))));
    }

    @Override
    protected void nativeInsert(String collection, List<VectorRecord> batch) {
        onEngine(collection, () -> engine.add(collection, batch));
    }

    @Override
    protected List<QueryMatch> nativeSearch(String collection, float[] vector, int nResults, Filter where) {
        return onEngine(collection, () -> engine.query(collection, vector, nResults, compile(where)).stream()
                .map(hit -> new QueryMatch(hit.id(), hit.text(), hit.metadata(), hit.distance()))
                .toList());
    }

    @Override
    protected long nativeCount(String collection) {
        return onEngine(collection, () -> (long) engine.count(collection));
    }

    @Override
    protected void nativeDelete(String collection, Filter where) {
        onEngine(collection, () -> engine.delete(collection, compile(where)));
    }

    @Override
    protected AbstractVectorStore newView(StoreOptions viewOptions) {
        return new LocalVectorStore(engine, viewOptions, metric);
    }

    private static <T> T onEngine(String collection, Supplier<T> call) {
        try {
            return call.get();
        } catch (InvalidDimensionException e) {
            throw new DimensionMismatchException(collection, e.expected(), e.actual(), e);
        } catch (UnknownCollectionException e) {
            throw new CollectionNotReadyException(collection, e.getMessage());
        }
    }

    static Map<String, Object> compile(Filter filter) {
        List<Filter> conditions = filter.conditions();
        if (conditions.isEmpty()) {
            return Map.of();
        }
        if (conditions.size() == 1) {
            return condition(conditions.get(0));
        }
        List<Map<String, Object>> children = new ArrayList<>();
        conditions.forEach(condition -> children.add(condition(condition)));
        Map<String, Object> and = new LinkedHashMap<>();
        and.put(WhereClause.AND, children);
        return and;
    }

    private static Map<String, Object> condition(Filter filter) {
        Map<String, Object> node = new LinkedHashMap<>();
        if (filter instanceof Filter.Eq eq) {
            node.put(eq.field(), Map.of(WhereClause.EQ, eq.value()));
        } else if (filter instanceof Filter.In in) {
            node.put(in.field(), Map.of(WhereClause.IN, in.values()));
        } else {
            throw new IllegalArgumentException("Unsupported filter " + filter);
        }
        return node;
    }
}
