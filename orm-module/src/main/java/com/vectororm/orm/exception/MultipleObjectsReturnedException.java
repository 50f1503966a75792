package com.vectororm.orm.exception;

public class MultipleObjectsReturnedException extends ModelException {

    public MultipleObjectsReturnedException(String modelName) {
        super(modelName, "get() returned more than one " + modelName);
    }
}
