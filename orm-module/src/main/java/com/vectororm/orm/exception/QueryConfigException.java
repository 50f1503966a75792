package com.vectororm.orm.exception;

/**
 * Illegal combination of queryset chain calls.
 */
public class QueryConfigException extends VectorOrmException {

    public QueryConfigException(String message) {
        super(message);
    }
}
