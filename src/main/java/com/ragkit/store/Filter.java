package com.ragkit.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Metadata filter tree that every adapter compiles into its native query language.
 *
 * <p>The only composition is {@link And}; a caller-supplied {@code where} map with several keys is
 * always the conjunction of its entries, whatever the backend would do with a plain multi-key
 * filter.
 */
public interface Filter {

    boolean matches(Map<String, Object> metadata);

    static Filter all() {
        return And.EMPTY;
    }

    static Filter eq(String field, Object value) {
        return new Eq(field, value);
    }

    static Filter in(String field, Collection<?> values) {
        return new In(field, List.copyOf(values));
    }

    static Filter and(List<Filter> filters) {
        return new And(filters);
    }

    /**
     * Scalar values become {@link Eq}, collection values become {@link In}. Keys are visited in
     * sorted order so the compiled native filter is deterministic.
     */
    static Filter fromWhere(Map<String, ?> where) {
        if (where == null || where.isEmpty()) {
            return all();
        }
        List<Filter> conditions = new ArrayList<>();
        new TreeMap<>(where).forEach((field, value) -> {
            if (value instanceof Collection<?> values) {
                conditions.add(in(field, values));
            } else {
                conditions.add(eq(field, value));
            }
        });
        return conditions.size() == 1 ? conditions.get(0) : and(conditions);
    }

    default boolean isEmpty() {
        return this instanceof And and && and.filters().isEmpty();
    }

    /**
     * Leaf conditions of this filter, flattening nested conjunctions.
     */
    default List<Filter> conditions() {
        if (this instanceof And and) {
            List<Filter> out = new ArrayList<>();
            and.filters().forEach(filter -> out.addAll(filter.conditions()));
            return out;
        }
        return List.of(this);
    }

    record Eq(String field, Object value) implements Filter {
        public Eq {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(Map<String, Object> metadata) {
            return metadata != null && sameValue(value, metadata.get(field));
        }
    }

    record In(String field, List<?> values) implements Filter {
        public In {
            Objects.requireNonNull(field, "field");
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("In filter on '" + field + "' needs at least one value");
            }
        }

        @Override
        public boolean matches(Map<String, Object> metadata) {
            if (metadata == null) {
                return false;
            }
            Object actual = metadata.get(field);
            return values.stream().anyMatch(candidate -> sameValue(candidate, actual));
        }
    }

    record And(List<Filter> filters) implements Filter {
        static final And EMPTY = new And(List.of());

        public And {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean matches(Map<String, Object> metadata) {
            return filters.stream().allMatch(filter -> filter.matches(metadata));
        }
    }

    // 1 and 1L are equal metadata values; JSON round trips do not preserve the boxed type.
    private static boolean sameValue(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Number e && actual instanceof Number a) {
            if (isIntegral(e) && isIntegral(a)) {
                return e.longValue() == a.longValue();
            }
            return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
        }
        return expected.equals(actual);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte;
    }
}
