package com.ragkit.store.local;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.ragkit.store.Filter;

/**
 * Evaluates the engine's native where trees:
 * {@code {"field": value}}, {@code {"field": {"$eq": value}}}, {@code {"field": {"$in": [..]}}}
 * and {@code {"$and": [..]}}. A node must have exactly one key; the engine never guesses how
 * several keys combine.
 */
final class WhereClause {
    static final String AND = "$and";
    static final String EQ = "$eq";
    static final String IN = "$in";

    private WhereClause() {
    }

    static boolean matches(Map<?, ?> where, Map<String, Object> metadata) {
        if (where == null || where.isEmpty()) {
            return true;
        }
        if (where.size() != 1) {
            throw new IllegalArgumentException("Expected where to have exactly one operator, got " + where.keySet());
        }
        Map.Entry<?, ?> node = where.entrySet().iterator().next();
        if (AND.equals(node.getKey())) {
            if (!(node.getValue() instanceof List<?> children)) {
                throw new IllegalArgumentException("$and expects a list of where clauses");
            }
            for (Object child : children) {
                if (!(child instanceof Map<?, ?> clause)) {
                    throw new IllegalArgumentException("$and expects where clauses, got " + child);
                }
                if (!matches(clause, metadata)) {
                    return false;
                }
            }
            return true;
        }
        return condition(String.valueOf(node.getKey()), node.getValue()).matches(metadata);
    }

    private static Filter condition(String field, Object operand) {
        if (!(operand instanceof Map<?, ?> operator)) {
            return Filter.eq(field, operand);
        }
        if (operator.size() != 1) {
            throw new IllegalArgumentException("Expected operator expression for '" + field + "' to have exactly one operator");
        }
        Map.Entry<?, ?> entry = operator.entrySet().iterator().next();
        String op = String.valueOf(entry.getKey());
        return switch (op) {
            case EQ -> Filter.eq(field, entry.getValue());
            case IN -> {
                if (!(entry.getValue() instanceof Collection<?> values)) {
                    throw new IllegalArgumentException("$in on '" + field + "' expects a list");
                }
                yield Filter.in(field, values);
            }
            default -> throw new IllegalArgumentException("Unsupported where operator " + op);
        };
    }
}
