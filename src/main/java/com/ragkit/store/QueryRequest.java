package com.ragkit.store;

import java.util.Map;

/**
 * Either a query text, embedded by the store, or a caller-supplied vector.
 */
public record QueryRequest(String text, float[] vector, int nResults, Filter where) {
    public QueryRequest {
        if ((text == null) == (vector == null)) {
            throw new IllegalArgumentException("Exactly one of query text or query vector is required");
        }
        if (nResults <= 0) {
            throw new IllegalArgumentException("nResults must be > 0, was " + nResults);
        }
        where = where == null ? Filter.all() : where;
    }

    public static QueryRequest ofText(String text, int nResults) {
        return new QueryRequest(text, null, nResults, Filter.all());
    }

    public static QueryRequest ofVector(float[] vector, int nResults) {
        return new QueryRequest(null, vector, nResults, Filter.all());
    }

    public QueryRequest where(Filter filter) {
        return new QueryRequest(text, vector, nResults, filter);
    }

    public QueryRequest where(Map<String, ?> where) {
        return where(Filter.fromWhere(where));
    }

    public boolean hasVector() {
        return vector != null;
    }
}
