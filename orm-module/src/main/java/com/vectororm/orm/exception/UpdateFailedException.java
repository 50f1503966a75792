package com.vectororm.orm.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The delete half of an update succeeded and the insert half failed, so the record
 * is gone from the store. Both the deleted values and the values that could not be
 * written are preserved for the caller to retry with.
 */
public class UpdateFailedException extends ModelException {

    private final Object primaryKey;
    private final Map<String, Object> previousValues;
    private final Map<String, Object> pendingValues;

    public UpdateFailedException(String modelName,
                                 Object primaryKey,
                                 Map<String, Object> previousValues,
                                 Map<String, Object> pendingValues,
                                 Throwable cause) {
        super(modelName, "Update of " + modelName + " " + primaryKey
                + " deleted the old record but failed to insert the new one", cause);
        this.primaryKey = primaryKey;
        this.previousValues = Collections.unmodifiableMap(new LinkedHashMap<>(previousValues));
        this.pendingValues = Collections.unmodifiableMap(new LinkedHashMap<>(pendingValues));
    }

    public Object getPrimaryKey() {
        return primaryKey;
    }

    /**
     * Field values of the record as it was persisted before the delete
     */
    public Map<String, Object> getPreviousValues() {
        return previousValues;
    }

    /**
     * Field values the failed insert tried to write
     */
    public Map<String, Object> getPendingValues() {
        return pendingValues;
    }
}
