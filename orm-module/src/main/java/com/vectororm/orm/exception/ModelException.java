package com.vectororm.orm.exception;

/**
 * Error tied to one model. The model name is carried as data.
 */
public abstract class ModelException extends VectorOrmException {

    private final String modelName;

    protected ModelException(String modelName, String message) {
        super(message);
        this.modelName = modelName;
    }

    protected ModelException(String modelName, String message, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
