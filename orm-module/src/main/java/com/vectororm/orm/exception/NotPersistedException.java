package com.vectororm.orm.exception;

public class NotPersistedException extends ModelException {

    public NotPersistedException(String modelName) {
        this(modelName, "delete");
    }

    public NotPersistedException(String modelName, String operation) {
        super(modelName, "Cannot " + operation + " " + modelName + " instance that has no persisted primary key");
    }
}
