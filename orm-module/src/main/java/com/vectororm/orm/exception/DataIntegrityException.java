package com.vectororm.orm.exception;

/**
 * A row returned by the store does not validate against the model schema.
 */
public class DataIntegrityException extends ModelException {

    public DataIntegrityException(String modelName, ValidationException cause) {
        super(modelName, "Row returned for " + modelName + " failed validation: " + cause.getMessage(), cause);
    }
}
