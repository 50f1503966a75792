package com.vectororm.orm.exception;

/**
 * Root of the errors raised by models, querysets and mutations.
 */
public class VectorOrmException extends RuntimeException {

    public VectorOrmException(String message) {
        super(message);
    }

    public VectorOrmException(String message, Throwable cause) {
        super(message, cause);
    }
}
