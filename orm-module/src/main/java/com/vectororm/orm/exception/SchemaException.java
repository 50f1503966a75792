package com.vectororm.orm.exception;

/**
 * Invalid field or model declaration, or a malformed search directive.
 */
public class SchemaException extends VectorOrmException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
