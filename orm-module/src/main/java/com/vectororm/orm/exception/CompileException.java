package com.vectororm.orm.exception;

/**
 * A predicate tree cannot be rendered into a filter expression.
 */
public class CompileException extends VectorOrmException {

    public CompileException(String message) {
        super(message);
    }
}
