package com.vectororm.orm.query;

import java.util.List;

/**
 * Nearest-neighbour request attached to a queryset: which vector field to rank by,
 * the query vector, the metric and how many hits to keep.
 */
public record SearchDirective(String field, List<Float> vector, String metric, int topK) {

    public static final int DEFAULT_TOP_K = 10;

    public SearchDirective {
        vector = List.copyOf(vector);
    }
}
