package com.vectororm.orm.model;

import com.vectororm.orm.exception.NotPersistedException;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.exception.ValidationException;
import com.vectororm.orm.field.Field;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base class of every model. Subclasses pass their {@link ModelSchema} to the constructor
 * and usually add typed accessors:
 * <pre>{@code
 * public class Article extends Model {
 *     public static final Field<String> TITLE = Field.varchar("title", 200).build();
 *     public static final ModelSchema<Article> SCHEMA =
 *             ModelSchema.builder(Article.class, Article::new).field(TITLE).build();
 *
 *     public Article() { super(SCHEMA); }
 *
 *     public String getTitle() { return get(TITLE); }
 * }
 * }</pre>
 * Every assignment is validated. Instances are not thread-safe.
 */
public abstract class Model {

    private final ModelSchema<?> schema;
    private final Map<String, Object> values = new LinkedHashMap<>();

    // null while the instance has no record in the store
    private Map<String, Object> persistedValues;
    private Set<String> loadedFields;
    private Double distance;
    private boolean dirty = true;

    protected Model(ModelSchema<?> schema) {
        if (schema == null) {
            throw new SchemaException("Schema of " + getClass().getSimpleName()
                    + " is not initialised; declare fields and schema before creating instances");
        }
        this.schema = schema;
        for (Field<?> field : schema.fields().values()) {
            if (field.getDefaultValue() != null) {
                values.put(field.getName(), field.getDefaultValue());
            }
        }
    }

    public ModelSchema<?> schema() {
        return schema;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(Field<T> field) {
        return (T) values.get(owned(field).getName());
    }

    public Object get(String fieldName) {
        return values.get(schema.requireField(fieldName).getName());
    }

    public <T> Model set(Field<T> field, T value) {
        assignValidated(owned(field), value);
        return this;
    }

    public Model set(String fieldName, Object value) {
        assignValidated(schema.requireField(fieldName), value);
        return this;
    }

    /**
     * Current field values in schema order. Unset fields are absent.
     */
    public Map<String, Object> values() {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String name : schema.fields().keySet()) {
            if (values.containsKey(name)) {
                ordered.put(name, values.get(name));
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    public Object primaryKeyValue() {
        return values.get(schema.primaryKey().getName());
    }

    public boolean isPersisted() {
        return persistedValues != null;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Distance to the query vector when the instance was loaded by a search
     */
    public Optional<Double> distance() {
        return Optional.ofNullable(distance);
    }

    /**
     * Fields fetched through a projection, or empty when the instance was loaded whole
     */
    public Optional<Set<String>> loadedFields() {
        return Optional.ofNullable(loadedFields);
    }

    /**
     * Inserts the instance, or replaces its stored record if it is persisted and dirty.
     */
    public Mono<Void> save() {
        return schema.mutations().save(this);
    }

    /**
     * Assigns {@code changes} and replaces the stored record. Every value is validated
     * before any is assigned, so a rejected change leaves the instance untouched.
     * @return error {@link NotPersistedException} if the instance has no stored record
     */
    public Mono<Void> update(Map<String, ?> changes) {
        return Mono.defer(() -> {
            if (!isPersisted()) {
                return Mono.error(new NotPersistedException(schema.getModelName(), "update"));
            }
            Map<String, Object> validated = new LinkedHashMap<>();
            changes.forEach((name, value) -> {
                Field<?> field = schema.requireField(name);
                Object normalised = field.validate(value);
                if (field.isPrimaryKey() && !Objects.equals(normalised, primaryKeyValue())) {
                    throw new ValidationException(name, "primary key cannot be changed by update()");
                }
                validated.put(field.getName(), normalised);
            });
            validated.forEach(this::assign);
            return save();
        });
    }

    public Mono<Void> delete() {
        return schema.mutations().delete(this);
    }

    private Field<?> owned(Field<?> field) {
        Field<?> declared = schema.requireField(field.getName());
        if (declared != field) {
            throw new SchemaException("Field '" + field.getName() + "' does not belong to " + schema.getModelName());
        }
        return declared;
    }

    private void assignValidated(Field<?> field, Object value) {
        if (field.isAutoId() && value != null) {
            throw new ValidationException(field.getName(), "auto_id primary key is assigned by the store");
        }
        assign(field.getName(), field.validate(value));
    }

    // hooks for ModelSchema and MutationOrchestrator, values are validated by the caller

    void assign(String fieldName, Object value) {
        Object previous = values.put(fieldName, value);
        if (!Objects.equals(previous, value)) {
            dirty = true;
        }
    }

    void load(Map<String, Object> validated, Set<String> projection, Double searchDistance) {
        values.clear();
        values.putAll(validated);
        loadedFields = projection == null ? null : Set.copyOf(projection);
        distance = searchDistance;
        markPersisted();
    }

    void markPersisted() {
        persistedValues = new LinkedHashMap<>(values);
        dirty = false;
    }

    void markDetached() {
        persistedValues = null;
        dirty = true;
    }

    Map<String, Object> persistedValues() {
        return persistedValues == null ? Map.of() : Collections.unmodifiableMap(persistedValues);
    }

    Object persistedKey() {
        return persistedValues == null ? null : persistedValues.get(schema.primaryKey().getName());
    }

    @Override
    public String toString() {
        Object key = primaryKeyValue();
        return "<" + schema.getModelName() + ": " + (key == null ? "unsaved" : key) + ">";
    }
}
