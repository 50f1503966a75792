package com.vectororm.orm.model;

import com.google.common.collect.ImmutableMap;
import com.vectororm.common.model.ConsistencyLevel;
import com.vectororm.orm.connection.ConnectionRegistry;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.exception.ValidationException;
import com.vectororm.orm.expression.ExpressionCompiler;
import com.vectororm.orm.field.Field;
import com.vectororm.orm.query.QuerySet;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Immutable description of a model: ordered fields, target collection and connection alias.
 * Built once per model class, typically into a {@code static final} constant.
 *
 * @param <M> model type
 */
@Slf4j
@Getter
public final class ModelSchema<M extends Model> {

    public static final String IMPLICIT_PRIMARY_KEY = "id";

    private static final Pattern COLLECTION_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Class<M> modelClass;
    private final String modelName;
    private final String collectionName;
    private final String connectionAlias;
    private final ConnectionRegistry registry;
    private final ExpressionCompiler compiler;
    /**
     * Default read consistency of querysets, {@code null} for the collection's own default
     */
    private final ConsistencyLevel consistencyLevel;

    @Getter(AccessLevel.NONE)
    private final ImmutableMap<String, Field<?>> fields;
    @Getter(AccessLevel.NONE)
    private final Field<?> primaryKey;
    @Getter(AccessLevel.NONE)
    private final Supplier<M> factory;
    @Getter(AccessLevel.NONE)
    private final MutationOrchestrator mutations;

    private ModelSchema(Builder<M> builder, ImmutableMap<String, Field<?>> fields, Field<?> primaryKey) {
        this.modelClass = builder.modelClass;
        this.modelName = builder.modelClass.getSimpleName();
        this.collectionName = builder.collectionName;
        this.connectionAlias = builder.connectionAlias;
        this.registry = builder.registry;
        this.compiler = builder.compiler;
        this.consistencyLevel = builder.consistencyLevel;
        this.fields = fields;
        this.primaryKey = primaryKey;
        this.factory = builder.factory;
        this.mutations = new MutationOrchestrator(compiler);
    }

    public static <M extends Model> Builder<M> builder(Class<M> modelClass, Supplier<M> factory) {
        return new Builder<>(modelClass, factory);
    }

    /**
     * Fields in declaration order, the implicit primary key first when one was added
     */
    public Map<String, Field<?>> fields() {
        return fields;
    }

    public Optional<Field<?>> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * @throws SchemaException if the model has no field with this name
     */
    public Field<?> requireField(String name) {
        Field<?> field = fields.get(name);
        if (field == null) {
            throw new SchemaException(modelName + " has no field '" + name + "'");
        }
        return field;
    }

    public Field<?> primaryKey() {
        return primaryKey;
    }

    /**
     * Entry point for queries: an unevaluated queryset matching every record.
     */
    public QuerySet<M> objects() {
        return new QuerySet<>(this);
    }

    public M newInstance() {
        return factory.get();
    }

    /**
     * Builds an unsaved instance from raw values
     * @throws SchemaException for unknown field names
     * @throws ValidationException for invalid values
     */
    public M fromValues(Map<String, ?> values) {
        M instance = newInstance();
        values.forEach(instance::set);
        return instance;
    }

    /**
     * Turns a row returned by the store into a persisted instance
     * @param row raw row, unknown keys are ignored
     * @param projection fields requested through a projection, or {@code null} when all were fetched
     * @param distance search distance, or {@code null} for scalar queries
     * @throws ValidationException if a value does not satisfy its field or a required field is missing
     */
    public M materialize(Map<String, Object> row, Set<String> projection, Double distance) {
        Map<String, Object> validated = new LinkedHashMap<>();
        for (Field<?> field : fields.values()) {
            String name = field.getName();
            if (projection != null && !projection.contains(name)) {
                continue;
            }
            Object value = row.get(name);
            if (value == null && !field.isNullable()) {
                throw new ValidationException(name, "missing from the stored row");
            }
            validated.put(name, field.validate(value));
        }
        M instance = newInstance();
        instance.load(validated, projection, distance);
        return instance;
    }

    /**
     * Inserts unsaved instances with a single request
     * @return number of inserted records
     */
    public Mono<Long> bulkCreate(List<M> instances) {
        return mutations.bulkCreate(this, instances);
    }

    MutationOrchestrator mutations() {
        return mutations;
    }

    @Override
    public String toString() {
        return "ModelSchema{" + modelName + " -> " + collectionName + "@" + connectionAlias + ", fields=" + fields.values() + "}";
    }

    public static final class Builder<M extends Model> {
        private final Class<M> modelClass;
        private final Supplier<M> factory;
        private final List<Field<?>> declared = new ArrayList<>();
        private String collectionName;
        private String connectionAlias = ConnectionRegistry.DEFAULT_ALIAS;
        private ConnectionRegistry registry = ConnectionRegistry.global();
        private ExpressionCompiler compiler = new ExpressionCompiler();
        private ConsistencyLevel consistencyLevel;

        private Builder(Class<M> modelClass, Supplier<M> factory) {
            if (modelClass == null || factory == null) {
                throw new SchemaException("Model class and factory are required");
            }
            this.modelClass = modelClass;
            this.factory = factory;
            this.collectionName = modelClass.getSimpleName().toLowerCase(Locale.ROOT);
        }

        public Builder<M> collection(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder<M> alias(String connectionAlias) {
            this.connectionAlias = connectionAlias;
            return this;
        }

        public Builder<M> registry(ConnectionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder<M> compiler(ExpressionCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder<M> consistencyLevel(ConsistencyLevel consistencyLevel) {
            this.consistencyLevel = consistencyLevel;
            return this;
        }

        public Builder<M> field(Field<?> field) {
            declared.add(field);
            return this;
        }

        public Builder<M> fields(Field<?>... fields) {
            declared.addAll(List.of(fields));
            return this;
        }

        public ModelSchema<M> build() {
            String model = modelClass.getSimpleName();
            if (collectionName == null || !COLLECTION_PATTERN.matcher(collectionName).matches()) {
                throw new SchemaException("Invalid collection name '" + collectionName + "' for " + model);
            }
            if (connectionAlias == null || connectionAlias.isBlank()) {
                throw new SchemaException("Connection alias of " + model + " cannot be blank");
            }
            if (registry == null || compiler == null) {
                throw new SchemaException("Registry and compiler of " + model + " are required");
            }

            Map<String, Field<?>> byName = new LinkedHashMap<>();
            Field<?> primaryKey = null;
            for (Field<?> field : declared) {
                if (byName.putIfAbsent(field.getName(), field) != null) {
                    throw new SchemaException(model + " declares field '" + field.getName() + "' twice");
                }
                if (field.isPrimaryKey()) {
                    if (primaryKey != null) {
                        throw new SchemaException(model + " declares more than one primary key: '"
                                + primaryKey.getName() + "' and '" + field.getName() + "'");
                    }
                    primaryKey = field;
                }
            }

            ImmutableMap.Builder<String, Field<?>> ordered = ImmutableMap.builder();
            if (primaryKey == null) {
                if (byName.containsKey(IMPLICIT_PRIMARY_KEY)) {
                    throw new SchemaException(model + " declares '" + IMPLICIT_PRIMARY_KEY
                            + "' without primary key role and no other primary key");
                }
                primaryKey = Field.int64(IMPLICIT_PRIMARY_KEY).primaryKey().autoId().build();
                ordered.put(IMPLICIT_PRIMARY_KEY, primaryKey);
                log.debug("{} declares no primary key, added implicit '{}'", model, IMPLICIT_PRIMARY_KEY);
            }
            ordered.putAll(byName);
            return new ModelSchema<>(this, ordered.build(), primaryKey);
        }
    }
}
