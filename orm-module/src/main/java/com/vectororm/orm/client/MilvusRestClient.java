package com.vectororm.orm.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vectororm.common.client.VectorStoreClient;
import com.vectororm.common.client.VectorStoreException;
import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.InsertResult;
import com.vectororm.common.model.QueryRequest;
import com.vectororm.common.model.SearchHit;
import com.vectororm.common.model.SearchRequest;
import com.vectororm.common.serialization.MilvusResponseReader;
import com.vectororm.orm.exception.QueryConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link VectorStoreClient} over the Milvus RESTful API v2.
 * Milvus cannot order scalar queries, so {@link #supportsOrdering()} is false.
 * <p>
 * Scalar queries must keep offset plus limit within {@link #maxQueryWindow()}. A query
 * without a limit asks for the rest of the window after its offset; a query whose offset
 * plus limit exceeds the window fails with {@link QueryConfigException} before any request.
 */
@Slf4j
public class MilvusRestClient implements VectorStoreClient {

    private static final String API_BASE_PATH = "/v2/vectordb/entities";

    private final WebClient webClient;
    private final MilvusResponseReader responseReader;
    private final String database;
    private final int maxQueryWindow;

    public MilvusRestClient(WebClient webClient, MilvusResponseReader responseReader, String database, int maxQueryWindow) {
        this.webClient = webClient;
        this.responseReader = responseReader;
        this.database = database == null || database.isBlank() ? null : database;
        this.maxQueryWindow = maxQueryWindow;
    }

    @Override
    public Mono<List<Map<String, Object>>> query(QueryRequest request) {
        if (request.orderBy() != null) {
            return Mono.error(new VectorStoreException("Milvus cannot order query results by " + request.orderBy()));
        }
        int offset = request.offset() == null ? 0 : request.offset();
        long requested = request.limit() == null ? 1L : request.limit();
        if (offset + requested > maxQueryWindow) {
            return Mono.error(new QueryConfigException("Offset " + offset
                    + (request.limit() == null ? "" : " plus limit " + request.limit())
                    + " exceeds the query window of " + maxQueryWindow + " rows"));
        }
        int limit = request.limit() == null ? maxQueryWindow - offset : request.limit();
        log.debug("Querying collection {} with filter '{}'", request.collectionName(), request.filter());

        QueryPayload payload = new QueryPayload(database, request.collectionName(), request.filter(),
                request.outputFields(), limit, request.offset(), request.consistencyLevel());
        return post("/query", payload)
                .map(responseReader::readRows)
                .doOnSuccess(rows -> log.debug("Query on {} returned {} rows", request.collectionName(), rows.size()))
                .doOnError(error -> log.error("Failed to query collection {}: {}", request.collectionName(), error.getMessage()));
    }

    @Override
    public Mono<List<SearchHit>> search(SearchRequest request) {
        log.debug("Searching collection {} on {} (dimension {}, limit {})",
                request.collectionName(), request.annsField(), request.dimension(), request.limit());

        SearchPayload payload = new SearchPayload(database, request.collectionName(), List.of(request.vector()),
                request.annsField(), request.filter(), request.limit(), request.offset(), request.outputFields(),
                Map.of("metricType", request.metricType()), request.consistencyLevel());
        return post("/search", payload)
                .map(responseReader::readHits)
                .doOnSuccess(hits -> log.debug("Search on {} returned {} hits", request.collectionName(), hits.size()))
                .doOnError(error -> log.error("Failed to search collection {}: {}", request.collectionName(), error.getMessage()));
    }

    @Override
    public Mono<Long> count(String collectionName, String filter, ConsistencyLevel consistencyLevel) {
        log.debug("Counting collection {} with filter '{}'", collectionName, filter);

        QueryPayload payload = new QueryPayload(database, collectionName, filter == null ? "" : filter,
                List.of(MilvusResponseReader.COUNT_KEY), null, null, consistencyLevel);
        return post("/query", payload)
                .map(responseReader::readCount)
                .doOnSuccess(count -> log.debug("Count on {}: {}", collectionName, count))
                .doOnError(error -> log.error("Failed to count collection {}: {}", collectionName, error.getMessage()));
    }

    @Override
    public Mono<InsertResult> insert(String collectionName, List<Map<String, Object>> rows) {
        log.debug("Inserting {} rows into collection {}", rows.size(), collectionName);

        return post("/insert", new InsertPayload(database, collectionName, rows))
                .map(responseReader::readInsert)
                .doOnSuccess(result -> log.debug("Inserted {} rows into {}", result.insertCount(), collectionName))
                .doOnError(error -> log.error("Failed to insert into collection {}: {}", collectionName, error.getMessage()));
    }

    @Override
    public Mono<Long> delete(String collectionName, String filter) {
        log.debug("Deleting from collection {} with filter '{}'", collectionName, filter);

        return post("/delete", new DeletePayload(database, collectionName, filter))
                .map(responseReader::readDeleteCount)
                .doOnSuccess(count -> log.debug("Delete on {} result: {}", collectionName, count))
                .doOnError(error -> log.error("Failed to delete from collection {}: {}", collectionName, error.getMessage()));
    }

    @Override
    public boolean supportsCount() {
        return true;
    }

    @Override
    public int maxQueryWindow() {
        return maxQueryWindow;
    }

    private Mono<byte[]> post(String path, Object payload) {
        return webClient
                .post()
                .uri(API_BASE_PATH + path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(byte[].class)
                .switchIfEmpty(Mono.error(() -> new VectorStoreException("Empty response from " + path)))
                .onErrorMap(WebClientException.class,
                        error -> new VectorStoreException("Request to " + path + " failed: " + error.getMessage(), error));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueryPayload(String dbName, String collectionName, String filter, List<String> outputFields,
                               Integer limit, Integer offset, ConsistencyLevel consistencyLevel) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SearchPayload(String dbName, String collectionName, List<List<Float>> data, String annsField,
                                String filter, Integer limit, Integer offset, List<String> outputFields,
                                Map<String, Object> searchParams, ConsistencyLevel consistencyLevel) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InsertPayload(String dbName, String collectionName, List<Map<String, Object>> data) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DeletePayload(String dbName, String collectionName, String filter) {}
}
