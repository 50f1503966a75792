package com.vectororm.common.client;

import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.InsertResult;
import com.vectororm.common.model.QueryRequest;
import com.vectororm.common.model.SearchHit;
import com.vectororm.common.model.SearchRequest;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Client handle for a vector database.
 * Filter strings are passed through verbatim in the store's own boolean-expression grammar.
 * Implementations signal failures with {@link VectorStoreException}.
 */
public interface VectorStoreClient {

    /**
     * Largest number of rows a single scalar query may return.
     */
    int DEFAULT_MAX_QUERY_WINDOW = 16384;

    /**
     * Run a scalar query. Without a limit at most {@link #maxQueryWindow()} minus the
     * offset rows are returned.
     * @param request collection, filter, projection and pagination
     * @return matching rows keyed by field name
     */
    Mono<List<Map<String, Object>>> query(QueryRequest request);

    /**
     * Run a nearest-neighbour search
     * @param request vector, field, metric, limit and scalar pre-filter
     * @return hits ranked by distance, closest first
     */
    Mono<List<SearchHit>> search(SearchRequest request);

    /**
     * Count rows matching a filter. Only called when {@link #supportsCount()} is true.
     * @param collectionName target collection
     * @param filter boolean expression, empty for all rows
     * @param consistencyLevel read consistency, or {@code null} for the collection's default
     * @return number of matching rows
     */
    default Mono<Long> count(String collectionName, String filter, ConsistencyLevel consistencyLevel) {
        return Mono.error(new UnsupportedOperationException(
                getClass().getSimpleName() + " does not support count requests"));
    }

    /**
     * Insert rows
     * @param collectionName target collection
     * @param rows rows keyed by field name
     * @return inserted count and the primary keys reported by the store
     */
    Mono<InsertResult> insert(String collectionName, List<Map<String, Object>> rows);

    /**
     * Delete rows matching a filter
     * @param collectionName target collection
     * @param filter non-empty boolean expression
     * @return number of deleted rows, or -1 when the store does not report it
     */
    Mono<Long> delete(String collectionName, String filter);

    default boolean supportsCount() {
        return false;
    }

    /**
     * Whether {@link QueryRequest#orderBy()} is honoured by the store.
     */
    default boolean supportsOrdering() {
        return false;
    }

    /**
     * Upper bound of offset plus limit for one scalar query.
     */
    default int maxQueryWindow() {
        return DEFAULT_MAX_QUERY_WINDOW;
    }
}
