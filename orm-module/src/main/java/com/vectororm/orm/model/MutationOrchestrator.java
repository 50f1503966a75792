package com.vectororm.orm.model;

import com.vectororm.common.client.VectorStoreClient;
import com.vectororm.common.client.VectorStoreException;
import com.vectororm.common.model.InsertResult;
import com.vectororm.orm.exception.NotPersistedException;
import com.vectororm.orm.exception.QueryConfigException;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.exception.UpdateFailedException;
import com.vectororm.orm.exception.ValidationException;
import com.vectororm.orm.expression.ExpressionCompiler;
import com.vectororm.orm.expression.Filters;
import com.vectororm.orm.field.Field;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists model instances.
 * <p>
 * The store has no in-place update, so saving a persisted instance deletes the record
 * by its persisted primary key and inserts the new values. The two requests are not
 * atomic: when the insert fails the record is gone, and {@link UpdateFailedException}
 * hands both versions back to the caller. Concurrent writers to the same record must be
 * serialised by the caller.
 */
@Slf4j
@RequiredArgsConstructor
class MutationOrchestrator {

    private final ExpressionCompiler compiler;

    Mono<Void> save(Model instance) {
        return Mono.defer(() -> {
            ModelSchema<?> schema = instance.schema();
            if (instance.isPersisted() && !instance.isDirty()) {
                log.debug("{} is unchanged, skipping save", instance);
                return Mono.empty();
            }
            checkWritable(instance);
            VectorStoreClient client = schema.getRegistry().resolve(schema.getConnectionAlias());
            Map<String, Object> row = toRow(instance);
            return instance.isPersisted()
                    ? update(client, instance, row)
                    : insert(client, instance, row);
        });
    }

    Mono<Void> delete(Model instance) {
        return Mono.defer(() -> {
            ModelSchema<?> schema = instance.schema();
            if (!instance.isPersisted()) {
                return Mono.error(new NotPersistedException(schema.getModelName()));
            }
            VectorStoreClient client = schema.getRegistry().resolve(schema.getConnectionAlias());
            String filter = keyFilter(schema, instance.persistedKey());
            log.debug("Deleting {} from {} where {}", instance, schema.getCollectionName(), filter);
            return client.delete(schema.getCollectionName(), filter)
                    .doOnNext(deleted -> {
                        if (deleted == 0) {
                            log.warn("Delete of {} matched no record in {}", instance, schema.getCollectionName());
                        }
                        instance.markDetached();
                    })
                    .then();
        });
    }

    <M extends Model> Mono<Long> bulkCreate(ModelSchema<M> schema, List<M> instances) {
        return Mono.defer(() -> {
            if (instances.isEmpty()) {
                return Mono.just(0L);
            }
            List<Map<String, Object>> rows = new ArrayList<>(instances.size());
            for (M instance : instances) {
                if (instance.schema() != schema) {
                    throw new SchemaException(instance + " is not a " + schema.getModelName());
                }
                if (instance.isPersisted()) {
                    throw new ValidationException(schema.primaryKey().getName(),
                            instance + " is already persisted; use save() to update it");
                }
                checkWritable(instance);
                rows.add(toRow(instance));
            }

            VectorStoreClient client = schema.getRegistry().resolve(schema.getConnectionAlias());
            log.debug("Bulk inserting {} {} rows into {}", rows.size(), schema.getModelName(), schema.getCollectionName());
            return client.insert(schema.getCollectionName(), rows)
                    .flatMap(result -> acknowledged(schema, result))
                    .map(result -> {
                        for (int i = 0; i < instances.size(); i++) {
                            assignGeneratedKey(instances.get(i), result, i);
                            instances.get(i).markPersisted();
                        }
                        return result.insertCount();
                    });
        });
    }

    private Mono<Void> insert(VectorStoreClient client, Model instance, Map<String, Object> row) {
        ModelSchema<?> schema = instance.schema();
        log.debug("Inserting {} into {}", instance, schema.getCollectionName());
        return client.insert(schema.getCollectionName(), List.of(row))
                .flatMap(result -> acknowledged(schema, result))
                .doOnNext(result -> {
                    assignGeneratedKey(instance, result, 0);
                    instance.markPersisted();
                })
                .then();
    }

    private Mono<Void> update(VectorStoreClient client, Model instance, Map<String, Object> row) {
        ModelSchema<?> schema = instance.schema();
        String collection = schema.getCollectionName();
        Object key = instance.persistedKey();
        Map<String, Object> previous = new LinkedHashMap<>(instance.persistedValues());
        String filter = keyFilter(schema, key);

        Mono<InsertResult> reinsert = Mono.defer(() -> client.insert(collection, List.of(row)))
                .flatMap(result -> acknowledged(schema, result))
                .onErrorMap(cause -> {
                    instance.markDetached();
                    log.error("Update of {} {} lost the stored record: delete succeeded, insert failed",
                            schema.getModelName(), key, cause);
                    return new UpdateFailedException(schema.getModelName(), key, previous, row, cause);
                });

        log.debug("Updating {} in {}: delete where {} then insert", instance, collection, filter);
        return client.delete(collection, filter)
                .doOnNext(deleted -> {
                    if (deleted == 0) {
                        log.warn("Update of {} {}: delete matched no record, inserting anyway", schema.getModelName(), key);
                    }
                })
                .then(reinsert)
                .doOnNext(result -> {
                    assignGeneratedKey(instance, result, 0);
                    instance.markPersisted();
                })
                .then();
    }

    private void checkWritable(Model instance) {
        if (instance.loadedFields().isPresent()) {
            throw new QueryConfigException(instance + " was loaded with a projection of "
                    + instance.loadedFields().get() + " and cannot be saved");
        }
        Map<String, Object> values = instance.values();
        for (Field<?> field : instance.schema().fields().values()) {
            if (!field.isOptional() && values.get(field.getName()) == null) {
                throw new ValidationException(field.getName(), "value is required");
            }
        }
    }

    private Map<String, Object> toRow(Model instance) {
        Map<String, Object> values = instance.values();
        Map<String, Object> row = new LinkedHashMap<>();
        for (Field<?> field : instance.schema().fields().values()) {
            Object value = values.get(field.getName());
            if (field.isAutoId() || value == null) {
                continue;
            }
            row.put(field.getName(), value);
        }
        return row;
    }

    private String keyFilter(ModelSchema<?> schema, Object key) {
        return compiler.render(Filters.eq(schema.primaryKey().getName(), key));
    }

    private Mono<InsertResult> acknowledged(ModelSchema<?> schema, InsertResult result) {
        if (result.insertCount() < 1) {
            return Mono.error(new VectorStoreException("Insert into " + schema.getCollectionName()
                    + " was not acknowledged by the store"));
        }
        return Mono.just(result);
    }

    private void assignGeneratedKey(Model instance, InsertResult result, int index) {
        Field<?> primaryKey = instance.schema().primaryKey();
        if (!primaryKey.isAutoId()) {
            return;
        }
        if (index >= result.primaryKeys().size()) {
            log.warn("Store reported no generated key for {} at position {}", instance, index);
            return;
        }
        instance.assign(primaryKey.getName(), primaryKey.validate(result.primaryKeys().get(index)));
    }
}
