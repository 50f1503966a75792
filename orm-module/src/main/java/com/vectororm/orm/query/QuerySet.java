package com.vectororm.orm.query;

import com.vectororm.common.client.VectorStoreClient;
import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.common.model.QueryRequest;
import com.vectororm.common.model.SearchHit;
import com.vectororm.common.model.SearchRequest;
import com.vectororm.common.model.SortKey;
import com.vectororm.orm.exception.CompileException;
import com.vectororm.orm.exception.DataIntegrityException;
import com.vectororm.orm.exception.DoesNotExistException;
import com.vectororm.orm.exception.MultipleObjectsReturnedException;
import com.vectororm.orm.exception.QueryConfigException;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.exception.ValidationException;
import com.vectororm.orm.expression.CompiledFilter;
import com.vectororm.orm.expression.Condition;
import com.vectororm.orm.expression.Filters;
import com.vectororm.orm.expression.Negation;
import com.vectororm.orm.field.Field;
import com.vectororm.orm.model.Model;
import com.vectororm.orm.model.ModelSchema;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Lazy, immutable query over a model's collection.
 * <p>
 * Chain methods validate their arguments immediately and return a new queryset; nothing
 * touches the store until a terminal method's publisher is subscribed. The result of
 * {@link #evaluate()} is cached per queryset, so repeated terminals on the same instance
 * issue one request.
 *
 * @param <M> model type
 */
@Slf4j
public final class QuerySet<M extends Model> {

    private final ModelSchema<M> schema;
    private final QuerySpec spec;
    private final AtomicReference<Mono<List<M>>> result = new AtomicReference<>();

    public QuerySet(ModelSchema<M> schema) {
        this(schema, QuerySpec.EMPTY);
    }

    private QuerySet(ModelSchema<M> schema, QuerySpec spec) {
        this.schema = schema;
        this.spec = spec;
    }

    public QuerySpec spec() {
        return spec;
    }

    public ModelSchema<M> schema() {
        return schema;
    }

    // ---- chain methods ----

    public QuerySet<M> filter(Condition condition) {
        return with(spec.and(attach(condition)));
    }

    public QuerySet<M> filter(String lookup, Object value) {
        return filter(Filters.lookup(lookup, value));
    }

    public QuerySet<M> filter(Map<String, ?> lookups) {
        return filter(Filters.lookups(lookups));
    }

    public QuerySet<M> exclude(Condition condition) {
        return with(spec.and(attach(new Negation(condition))));
    }

    public QuerySet<M> exclude(String lookup, Object value) {
        return exclude(Filters.lookup(lookup, value));
    }

    public QuerySet<M> exclude(Map<String, ?> lookups) {
        return exclude(Filters.lookups(lookups));
    }

    /**
     * Replaces the ordering. {@code "-field"} sorts descending.
     * Searches only accept ascending {@code distance}.
     */
    public QuerySet<M> orderBy(String key) {
        SortKey sortKey;
        try {
            sortKey = SortKey.parse(key);
        } catch (IllegalArgumentException e) {
            throw new QueryConfigException(e.getMessage());
        }

        if (Field.DISTANCE.equals(sortKey.field())) {
            if (sortKey.descending()) {
                throw new QueryConfigException("Search results are ranked by ascending distance; '-distance' is not supported");
            }
        } else {
            Field<?> field = schema.requireField(sortKey.field());
            if (!field.getType().isOrderable()) {
                throw new QueryConfigException("Cannot order by '" + field.getName() + "' of type "
                        + field.getType().storageType());
            }
            if (spec.search() != null) {
                throw new QueryConfigException("Cannot order a vector search by '" + sortKey
                        + "'; search results are ranked by distance");
            }
        }
        return with(spec.withOrderBy(sortKey));
    }

    public QuerySet<M> limit(int limit) {
        if (limit <= 0) {
            throw new QueryConfigException("Limit must be positive but was " + limit);
        }
        return with(spec.withLimit(limit));
    }

    public QuerySet<M> offset(int offset) {
        if (offset < 0) {
            throw new QueryConfigException("Offset cannot be negative but was " + offset);
        }
        return with(spec.withOffset(offset));
    }

    /**
     * Ranks results by similarity of {@code field} to {@code vector}, keeping the closest {@code topK}.
     * The current filter becomes the search's pre-filter.
     */
    public QuerySet<M> search(List<? extends Number> vector, String field, String metric, int topK) {
        Field<?> vectorField = schema.requireField(field);
        if (!vectorField.isVector()) {
            throw new SchemaException("Field '" + field + "' of " + schema.getModelName() + " is not a vector field");
        }
        if (topK <= 0) {
            throw new SchemaException("top_k must be positive but was " + topK);
        }
        if (metric == null || metric.isBlank()) {
            throw new SchemaException("Search metric cannot be blank");
        }
        List<Float> queryVector;
        try {
            @SuppressWarnings("unchecked")
            List<Float> validated = (List<Float>) vectorField.validate(vector);
            queryVector = validated;
        } catch (ValidationException e) {
            throw new SchemaException("Invalid query vector: " + e.getMessage(), e);
        }
        SortKey orderBy = spec.orderBy();
        if (orderBy != null && !Field.DISTANCE.equals(orderBy.field())) {
            throw new QueryConfigException("Cannot search a queryset ordered by '" + orderBy
                    + "'; search results are ranked by distance");
        }
        return with(spec.withSearch(new SearchDirective(field, queryVector, metric, topK)));
    }

    /**
     * Search with the field's metric and {@value SearchDirective#DEFAULT_TOP_K} results
     */
    public QuerySet<M> search(List<? extends Number> vector, String field) {
        Field<?> vectorField = schema.requireField(field);
        return search(vector, field, vectorField.getMetric(), SearchDirective.DEFAULT_TOP_K);
    }

    public QuerySet<M> search(float[] vector, String field) {
        List<Float> boxed = new ArrayList<>(vector.length);
        for (float component : vector) {
            boxed.add(component);
        }
        return search(boxed, field);
    }

    /**
     * Makes results carry their distance to {@code vector}, which then becomes filterable
     * ({@code distance__lt}) and orderable.
     */
    public QuerySet<M> annotateDistance(String field, List<? extends Number> vector) {
        return search(vector, field);
    }

    /**
     * Fetches only the named fields and the primary key. Instances loaded this way cannot be saved.
     */
    public QuerySet<M> only(String... fieldNames) {
        Set<String> requested = new LinkedHashSet<>();
        for (String name : fieldNames) {
            requested.add(schema.requireField(name).getName());
        }
        List<String> projection = new ArrayList<>();
        for (String name : schema.fields().keySet()) {
            if (name.equals(schema.primaryKey().getName()) || requested.contains(name)) {
                projection.add(name);
            }
        }
        return with(spec.withProjection(projection));
    }

    /**
     * Fetches every field except the named ones. The primary key is never deferred.
     */
    public QuerySet<M> defer(String... fieldNames) {
        Set<String> deferred = new LinkedHashSet<>();
        for (String name : fieldNames) {
            deferred.add(schema.requireField(name).getName());
        }
        deferred.remove(schema.primaryKey().getName());
        List<String> base = spec.projection().isEmpty() ? new ArrayList<>(schema.fields().keySet()) : spec.projection();
        List<String> projection = new ArrayList<>();
        for (String name : base) {
            if (!deferred.contains(name)) {
                projection.add(name);
            }
        }
        return with(spec.withProjection(projection));
    }

    /**
     * Reads from another collection sharing this model's schema
     */
    public QuerySet<M> on(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new QueryConfigException("Collection name cannot be blank");
        }
        return with(spec.withCollection(collection));
    }

    /**
     * Read consistency for this queryset, overriding the model's default.
     * {@link ConsistencyLevel#STRONG} makes a read observe a preceding save.
     */
    public QuerySet<M> consistency(ConsistencyLevel level) {
        if (level == null) {
            throw new QueryConfigException("Consistency level cannot be null");
        }
        return with(spec.withConsistency(level));
    }

    // ---- terminal methods ----

    /**
     * Evaluates the queryset once; later subscriptions replay the cached list.
     * A failed evaluation is not cached.
     */
    public Mono<List<M>> evaluate() {
        return Mono.defer(() -> {
            Mono<List<M>> cached = result.get();
            if (cached != null) {
                return cached;
            }
            Mono<List<M>> fresh = Mono.defer(this::execute)
                    .doOnError(e -> result.set(null))
                    .cache();
            if (result.compareAndSet(null, fresh)) {
                return fresh;
            }
            Mono<List<M>> other = result.get();
            return other != null ? other : fresh;
        });
    }

    public Mono<List<M>> all() {
        return evaluate();
    }

    public Flux<M> flux() {
        return evaluate().flatMapIterable(Function.identity());
    }

    /**
     * Single match of the current filter
     * @return error {@link DoesNotExistException} or {@link MultipleObjectsReturnedException}
     * unless exactly one record matches
     */
    public Mono<M> get() {
        return limit(2).evaluate().flatMap(matches -> {
            if (matches.isEmpty()) {
                return Mono.error(new DoesNotExistException(schema.getModelName()));
            }
            if (matches.size() > 1) {
                return Mono.error(new MultipleObjectsReturnedException(schema.getModelName()));
            }
            return Mono.just(matches.get(0));
        });
    }

    public Mono<M> get(Condition condition) {
        return filter(condition).get();
    }

    public Mono<M> get(String lookup, Object value) {
        return filter(lookup, value).get();
    }

    public Mono<M> get(Map<String, ?> lookups) {
        return filter(lookups).get();
    }

    /**
     * First match, or empty when nothing matches
     */
    public Mono<M> first() {
        return limit(1).evaluate().flatMap(matches -> matches.isEmpty() ? Mono.empty() : Mono.just(matches.get(0)));
    }

    public Mono<Boolean> exists() {
        return first().hasElement();
    }

    /**
     * Number of records {@link #evaluate()} yields. A store-side count is capped at the
     * client's query window, since an unlimited query never returns more rows than that.
     */
    public Mono<Long> count() {
        return Mono.defer(() -> {
            Mono<List<M>> cached = result.get();
            if (cached != null) {
                return cached.map(matches -> (long) matches.size());
            }
            if (spec.search() == null && !spec.isPaginated()) {
                CompiledFilter filter = compile();
                VectorStoreClient client = resolveClient();
                if (client.supportsCount()) {
                    log.debug("Counting {} in {} where '{}'", schema.getModelName(), collection(), filter.expression());
                    int window = client.maxQueryWindow();
                    return client.count(collection(), filter.expression(), consistencyLevel()).map(total -> {
                        if (total > window) {
                            log.warn("{} of {} in {} match; count is capped at the query window of {} rows",
                                    total, schema.getModelName(), collection(), window);
                            return (long) window;
                        }
                        return total;
                    });
                }
            }
            return evaluate().map(matches -> (long) matches.size());
        });
    }

    /**
     * Deletes every record matching the filter
     * @return number of deleted records, or -1 when the store does not report it
     */
    public Mono<Long> delete() {
        return Mono.defer(() -> {
            if (spec.search() != null || spec.orderBy() != null || spec.isPaginated()) {
                throw new QueryConfigException("delete() applies to filters only; remove search, ordering and pagination");
            }
            CompiledFilter filter = compile();
            if (filter.isMatchAll()) {
                throw new QueryConfigException("Refusing to delete every " + schema.getModelName()
                        + " record; add a filter");
            }
            log.debug("Deleting {} from {} where '{}'", schema.getModelName(), collection(), filter.expression());
            return resolveClient().delete(collection(), filter.expression());
        });
    }

    /**
     * Builds an instance from {@code values} and saves it
     */
    public Mono<M> create(Map<String, ?> values) {
        return Mono.defer(() -> {
            if (spec.collection() != null) {
                throw new QueryConfigException("create() writes to the model's own collection and cannot be used after on()");
            }
            M instance = schema.fromValues(values);
            return instance.save().thenReturn(instance);
        });
    }

    /**
     * Fetches the single match of {@code lookups}, creating it from the equality lookups
     * and {@code defaults} when nothing matches
     * @return the instance and whether it was created
     */
    public Mono<Tuple2<M, Boolean>> getOrCreate(Map<String, ?> lookups, Map<String, ?> defaults) {
        return get(lookups)
                .map(found -> Tuples.of(found, false))
                .onErrorResume(DoesNotExistException.class, missing -> {
                    Map<String, Object> values = new LinkedHashMap<>();
                    lookups.forEach((key, value) -> {
                        if (!key.contains("__") || key.endsWith("__exact")) {
                            values.put(key.endsWith("__exact") ? key.substring(0, key.length() - 7) : key, value);
                        }
                    });
                    values.putAll(defaults);
                    return create(values).map(created -> Tuples.of(created, true));
                });
    }

    // ---- evaluation ----

    private Mono<List<M>> execute() {
        CompiledFilter filter = compile();
        SearchDirective search = spec.search();
        VectorStoreClient client = resolveClient();
        return search == null ? query(client, filter) : search(client, filter, search);
    }

    private Mono<List<M>> query(VectorStoreClient client, CompiledFilter filter) {
        SortKey orderBy = spec.orderBy();
        List<String> outputFields = outputFields();

        if (orderBy == null || client.supportsOrdering()) {
            QueryRequest request = new QueryRequest(collection(), filter.expression(), outputFields,
                    spec.limit(), spec.offset(), orderBy, consistencyLevel());
            log.debug("Querying {} where '{}' (limit {}, offset {}, order {})", request.collectionName(),
                    request.filter(), request.limit(), request.offset(), orderBy);
            int window = client.maxQueryWindow() - (spec.offset() == null ? 0 : spec.offset());
            return client.query(request).map(rows -> {
                if (spec.limit() == null && rows.size() >= window) {
                    log.warn("Query on {} filled the query window of {} rows; later records are not returned",
                            request.collectionName(), client.maxQueryWindow());
                }
                return materializeRows(rows, projection());
            });
        }

        List<String> fetched = outputFields;
        Set<String> projection = projection();
        if (!fetched.contains(orderBy.field())) {
            fetched = new ArrayList<>(outputFields);
            fetched.add(orderBy.field());
            projection = Set.copyOf(fetched);
        }
        Set<String> loaded = projection;
        int window = client.maxQueryWindow();
        QueryRequest request = new QueryRequest(collection(), filter.expression(), fetched, window, null, null,
                consistencyLevel());
        log.debug("Querying {} where '{}' for local ordering by {} (window {})", request.collectionName(),
                request.filter(), orderBy, window);
        return client.query(request).map(rows -> {
            if (rows.size() >= window) {
                log.warn("Query on {} filled the query window of {} rows; ordering by {} may be incomplete",
                        request.collectionName(), window, orderBy);
            }
            List<M> sorted = new ArrayList<>(materializeRows(rows, loaded));
            sorted.sort(comparator(orderBy));
            int from = Math.min(spec.offset() == null ? 0 : spec.offset(), sorted.size());
            int to = spec.limit() == null ? sorted.size() : Math.min(sorted.size(), from + spec.limit());
            return List.copyOf(sorted.subList(from, to));
        });
    }

    private Mono<List<M>> search(VectorStoreClient client, CompiledFilter filter, SearchDirective search) {
        int limit = spec.limit() == null ? search.topK() : Math.min(spec.limit(), search.topK());
        SearchRequest request = SearchRequest.builder()
                .collectionName(collection())
                .annsField(search.field())
                .vector(search.vector())
                .metricType(search.metric())
                .limit(limit)
                .offset(spec.offset())
                .filter(filter.expression())
                .outputFields(outputFields())
                .consistencyLevel(consistencyLevel())
                .build();
        log.debug("Searching {}.{} ({}, limit {}) with pre-filter '{}' and distance bound {}",
                request.collectionName(), request.annsField(), request.metricType(), limit,
                request.filter(), filter.maxDistance());

        return client.search(request).map(hits -> {
            List<M> instances = new ArrayList<>(hits.size());
            for (SearchHit hit : hits) {
                if (filter.admits(hit.distance())) {
                    instances.add(materialize(hit.entity(), projection(), hit.distance()));
                }
            }
            log.debug("Search on {} returned {} hits, {} within bound", request.collectionName(), hits.size(), instances.size());
            return List.copyOf(instances);
        });
    }

    // every terminal compiles through here before touching the store
    private CompiledFilter compile() {
        CompiledFilter filter = schema.getCompiler().compile(spec.where(), schema.fields());
        if (spec.search() == null) {
            if (filter.hasDistanceBound()) {
                throw new CompileException("Distance filters require search() or annotateDistance()");
            }
            if (spec.orderBy() != null && Field.DISTANCE.equals(spec.orderBy().field())) {
                throw new QueryConfigException("Ordering by distance requires search() or annotateDistance()");
            }
        }
        return filter;
    }

    private ConsistencyLevel consistencyLevel() {
        return spec.consistency() != null ? spec.consistency() : schema.getConsistencyLevel();
    }

    private VectorStoreClient resolveClient() {
        return schema.getRegistry().resolve(schema.getConnectionAlias());
    }

    private List<M> materializeRows(List<Map<String, Object>> rows, Set<String> projection) {
        List<M> instances = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            instances.add(materialize(row, projection, null));
        }
        log.debug("Loaded {} {} rows", instances.size(), schema.getModelName());
        return List.copyOf(instances);
    }

    private M materialize(Map<String, Object> row, Set<String> projection, Double distance) {
        try {
            return schema.materialize(row, projection, distance);
        } catch (ValidationException e) {
            throw new DataIntegrityException(schema.getModelName(), e);
        }
    }

    // null when every field is fetched
    private Set<String> projection() {
        return spec.projection().isEmpty() ? null : Set.copyOf(spec.projection());
    }

    private List<String> outputFields() {
        return spec.projection().isEmpty() ? List.copyOf(schema.fields().keySet()) : spec.projection();
    }

    private String collection() {
        return spec.collection() != null ? spec.collection() : schema.getCollectionName();
    }

    private Condition attach(Condition condition) {
        if (condition == null) {
            throw new CompileException("Filter condition cannot be null");
        }
        schema.getCompiler().check(condition, schema.fields());
        return condition;
    }

    private QuerySet<M> with(QuerySpec next) {
        return new QuerySet<>(schema, next);
    }

    private Comparator<M> comparator(SortKey orderBy) {
        Comparator<Object> order = QuerySet::compareValues;
        if (orderBy.descending()) {
            order = order.reversed();
        }
        return Comparator.<M, Object>comparing(instance -> instance.get(orderBy.field()), Comparator.nullsLast(order));
    }

    // values of one orderable field share a Comparable type after validation
    @SuppressWarnings("unchecked")
    private static int compareValues(Object left, Object right) {
        return ((Comparable<Object>) left).compareTo(right);
    }

    @Override
    public String toString() {
        return "QuerySet<" + schema.getModelName() + ">" + spec;
    }
}
