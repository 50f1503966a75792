package com.vectororm.orm.field;

import java.math.BigInteger;

/**
 * Semantic field types and the storage data type each maps to.
 */
public enum FieldType {
    INT64("Int64"),
    FLOAT("Float"),
    VARCHAR("VarChar"),
    BOOL("Bool"),
    JSON("JSON"),
    FLOAT_VECTOR("FloatVector");

    private final String storageType;

    FieldType(String storageType) {
        this.storageType = storageType;
    }

    public String storageType() {
        return storageType;
    }

    public boolean isNumeric() {
        return this == INT64 || this == FLOAT;
    }

    /**
     * Whether scalar predicates may reference a field of this type.
     */
    public boolean isFilterable() {
        return this != JSON && this != FLOAT_VECTOR;
    }

    public boolean isOrderable() {
        return isNumeric() || this == VARCHAR;
    }

    /**
     * Whether a predicate operand has the Java type expected for this field type.
     * Only the type is checked, not field constraints such as max length.
     */
    public boolean acceptsOperand(Object operand) {
        return switch (this) {
            case INT64 -> isIntegral(operand);
            case FLOAT -> operand instanceof Number;
            case VARCHAR -> operand instanceof String;
            case BOOL -> operand instanceof Boolean;
            case JSON, FLOAT_VECTOR -> false;
        };
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }
}
