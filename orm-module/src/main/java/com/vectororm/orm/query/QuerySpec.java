package com.vectororm.orm.query;

import com.google.common.collect.ImmutableList;
import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.SortKey;
import com.vectororm.orm.expression.Condition;
import lombok.With;

import java.util.List;

/**
 * Immutable description of what a queryset will fetch. {@code null} components are unset;
 * an empty projection means every field.
 */
@With
public record QuerySpec(
        Condition where,
        SortKey orderBy,
        Integer limit,
        Integer offset,
        SearchDirective search,
        List<String> projection,
        String collection,
        ConsistencyLevel consistency
) {
    public static final QuerySpec EMPTY = new QuerySpec(null, null, null, null, null, List.of(), null, null);

    public QuerySpec {
        projection = projection == null ? ImmutableList.of() : ImmutableList.copyOf(projection);
    }

    /**
     * AND-combines a condition with the current predicate
     */
    public QuerySpec and(Condition condition) {
        return withWhere(where == null ? condition : where.and(condition));
    }

    public boolean isPaginated() {
        return limit != null || offset != null;
    }
}
