package com.vectororm.orm.exception;

/**
 * A value does not satisfy the constraints of the field it is assigned to.
 */
public class ValidationException extends VectorOrmException {

    private final String fieldName;

    public ValidationException(String fieldName, String message) {
        super("Field '" + fieldName + "': " + message);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
