package com.vectororm.orm.exception;

public class DoesNotExistException extends ModelException {

    public DoesNotExistException(String modelName) {
        super(modelName, modelName + " matching query does not exist");
    }
}
