package com.vectororm.orm.expression;

/**
 * Output of the compiler: the scalar filter expression (empty for "match all") and the
 * distance bound lifted out of the tree, if any.
 */
public record CompiledFilter(String expression, Double maxDistance) {

    public static final CompiledFilter MATCH_ALL = new CompiledFilter("", null);

    public CompiledFilter {
        expression = expression == null ? "" : expression;
    }

    public boolean isMatchAll() {
        return expression.isEmpty();
    }

    public boolean hasDistanceBound() {
        return maxDistance != null;
    }

    /**
     * Whether a search hit at this distance passes the lifted bound
     */
    public boolean admits(double distance) {
        return maxDistance == null || distance < maxDistance;
    }
}
