package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;
import com.vectororm.orm.field.Field;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * Static factory for predicate trees.
 * <pre>{@code
 * Condition c = Filters.contains("title", "vector").and(Filters.gt("views", 100));
 * Condition same = Filters.lookups(Map.of("title__contains", "vector", "views__gt", 100));
 * }</pre>
 */
public final class Filters {

    private static final String LOOKUP_SEPARATOR = "__";

    private Filters() {
    }

    public static Comparison eq(String field, Object value) {
        return new Comparison(field, Operator.EQ, value);
    }

    public static Comparison ne(String field, Object value) {
        return new Comparison(field, Operator.NE, value);
    }

    public static Comparison gt(String field, Object value) {
        return new Comparison(field, Operator.GT, value);
    }

    public static Comparison gte(String field, Object value) {
        return new Comparison(field, Operator.GTE, value);
    }

    public static Comparison lt(String field, Object value) {
        return new Comparison(field, Operator.LT, value);
    }

    public static Comparison lte(String field, Object value) {
        return new Comparison(field, Operator.LTE, value);
    }

    /**
     * Values that contain {@code value}. {@code %} and {@code _} in {@code value} are not wildcards.
     */
    public static Comparison contains(String field, String value) {
        return new Comparison(field, Operator.CONTAINS, value);
    }

    /**
     * Values that start with {@code value}. {@code %} and {@code _} in {@code value} are not wildcards.
     */
    public static Comparison startsWith(String field, String value) {
        return new Comparison(field, Operator.STARTS_WITH, value);
    }

    /**
     * Values that end with {@code value}. {@code %} and {@code _} in {@code value} are not wildcards.
     */
    public static Comparison endsWith(String field, String value) {
        return new Comparison(field, Operator.ENDS_WITH, value);
    }

    public static Comparison in(String field, Collection<?> values) {
        return new Comparison(field, Operator.IN, values);
    }

    public static Comparison in(String field, Object... values) {
        return new Comparison(field, Operator.IN, Arrays.asList(values));
    }

    /**
     * Keeps search hits strictly closer than {@code bound}. Only valid as a top-level conjunct
     * of a queryset that performs a vector search.
     */
    public static Comparison distanceLessThan(double bound) {
        return new Comparison(Field.DISTANCE, Operator.DISTANCE_LT, bound);
    }

    public static Condition and(Condition first, Condition... rest) {
        Condition result = first;
        for (Condition next : rest) {
            result = result.and(next);
        }
        return result;
    }

    public static Condition or(Condition first, Condition... rest) {
        Condition result = first;
        for (Condition next : rest) {
            result = result.or(next);
        }
        return result;
    }

    public static Condition not(Condition condition) {
        return new Negation(condition);
    }

    /**
     * Builds a comparison from a {@code field__operator} key. A bare field name means equality.
     * {@code distance__lt} is the only lookup accepted on the distance pseudo-field.
     */
    public static Comparison lookup(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new CompileException("Lookup key cannot be blank");
        }
        int split = key.lastIndexOf(LOOKUP_SEPARATOR);
        String field = split < 0 ? key : key.substring(0, split);
        String suffix = split < 0 ? "exact" : key.substring(split + LOOKUP_SEPARATOR.length());

        if (Field.DISTANCE.equals(field)) {
            if (!Operator.LT.lookup().equals(suffix)) {
                throw new CompileException("Only 'distance__lt' is supported on the distance pseudo-field, got '" + key + "'");
            }
            if (!(value instanceof Number bound)) {
                throw new CompileException("'distance__lt' requires a numeric bound");
            }
            return distanceLessThan(bound.doubleValue());
        }

        Operator operator = Operator.fromLookup(suffix);
        Object operand = value;
        if (operator == Operator.IN && value instanceof Object[] array) {
            operand = Arrays.asList(array);
        }
        return new Comparison(field, operator, operand);
    }

    /**
     * AND-combines lookups in iteration order
     * @throws CompileException if {@code lookups} is empty
     */
    public static Condition lookups(Map<String, ?> lookups) {
        Condition result = null;
        for (Map.Entry<String, ?> entry : lookups.entrySet()) {
            Comparison next = lookup(entry.getKey(), entry.getValue());
            result = result == null ? next : result.and(next);
        }
        if (result == null) {
            throw new CompileException("At least one lookup is required");
        }
        return result;
    }
}
