package com.vectororm.orm.field;

import com.google.common.collect.ImmutableList;
import com.vectororm.orm.exception.SchemaException;
import com.vectororm.orm.exception.ValidationException;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed attribute descriptor of a model.
 * <p>
 * A field validates its own declaration when built (failing with {@link SchemaException})
 * and validates every value assigned to it (failing with {@link ValidationException}).
 * Values are normalised on the way in: integers become {@link Long}, floats {@link Double},
 * vectors an immutable {@code List<Float>}.
 *
 * @param <T> Java type of validated values
 */
@Getter
public final class Field<T> {

    /**
     * Name of the pseudo-field holding a search hit's distance.
     */
    public static final String DISTANCE = "distance";

    public static final String DEFAULT_METRIC = "L2";
    public static final int MAX_VARCHAR_LENGTH = 65535;
    public static final int MAX_DIMENSION = 32768;

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final FieldType type;
    private final Integer maxLength;
    private final Integer dimension;
    private final boolean nullable;
    private final boolean primaryKey;
    private final boolean autoId;
    private final String metric;
    private final String description;
    private final T defaultValue;

    private Field(Builder<T> builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.maxLength = builder.maxLength;
        this.dimension = builder.dimension;
        this.nullable = builder.nullable;
        this.primaryKey = builder.primaryKey;
        this.autoId = builder.autoId;
        this.metric = builder.metric;
        this.description = builder.description;
        this.defaultValue = builder.defaultValue == null ? null : validateDefault(builder.defaultValue);
    }

    public static Builder<Long> int64(String name) {
        return new Builder<>(name, FieldType.INT64);
    }

    public static Builder<Double> floating(String name) {
        return new Builder<>(name, FieldType.FLOAT);
    }

    public static Builder<String> varchar(String name, int maxLength) {
        Builder<String> builder = new Builder<>(name, FieldType.VARCHAR);
        builder.maxLength = maxLength;
        return builder;
    }

    public static Builder<Boolean> bool(String name) {
        return new Builder<>(name, FieldType.BOOL);
    }

    public static Builder<Object> json(String name) {
        return new Builder<>(name, FieldType.JSON);
    }

    public static Builder<List<Float>> floatVector(String name, int dimension) {
        Builder<List<Float>> builder = new Builder<>(name, FieldType.FLOAT_VECTOR);
        builder.dimension = dimension;
        builder.metric = DEFAULT_METRIC;
        return builder;
    }

    public boolean isVector() {
        return type == FieldType.FLOAT_VECTOR;
    }

    /**
     * Whether a row may omit this field: nullable fields and store-generated keys.
     */
    public boolean isOptional() {
        return nullable || autoId;
    }

    /**
     * Validates and normalises a value for this field
     * @param value raw value, possibly decoded from JSON
     * @return the normalised value
     * @throws ValidationException if the value violates the field's type or constraints
     */
    @SuppressWarnings("unchecked")
    public T validate(Object value) {
        if (value == null) {
            if (isOptional()) {
                return null;
            }
            throw new ValidationException(name, "value cannot be null");
        }

        Object normalised = switch (type) {
            case INT64 -> toLong(value);
            case FLOAT -> toDouble(value);
            case VARCHAR -> toVarchar(value);
            case BOOL -> toBoolean(value);
            case JSON -> toJson(value);
            case FLOAT_VECTOR -> toVector(value);
        };
        return (T) normalised;
    }

    private T validateDefault(T value) {
        try {
            return validate(value);
        } catch (ValidationException e) {
            throw new SchemaException("Default value of field '" + name + "' is invalid: " + e.getMessage(), e);
        }
    }

    private Long toLong(Object value) {
        if (value instanceof BigInteger big) {
            if (big.bitLength() >= Long.SIZE) {
                throw new ValidationException(name, "integer " + big + " is out of range");
            }
            return big.longValue();
        }
        if (FieldType.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        throw new ValidationException(name, "expected an integer but got " + describe(value));
    }

    private Double toDouble(Object value) {
        if (!(value instanceof Number number)) {
            throw new ValidationException(name, "expected a number but got " + describe(value));
        }
        double result = number.doubleValue();
        if (!Double.isFinite(result)) {
            throw new ValidationException(name, "number must be finite but was " + result);
        }
        return result;
    }

    private String toVarchar(Object value) {
        if (!(value instanceof String text)) {
            throw new ValidationException(name, "expected a string but got " + describe(value));
        }
        int length = text.codePointCount(0, text.length());
        if (length > maxLength) {
            throw new ValidationException(name, "length " + length + " exceeds max_length " + maxLength);
        }
        return text;
    }

    private Boolean toBoolean(Object value) {
        if (!(value instanceof Boolean flag)) {
            throw new ValidationException(name, "expected a boolean but got " + describe(value));
        }
        return flag;
    }

    private Object toJson(Object value) {
        if (value instanceof Map || value instanceof List || value instanceof String
                || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        throw new ValidationException(name, "value of type " + describe(value) + " is not JSON-compatible");
    }

    private List<Float> toVector(Object value) {
        ImmutableList.Builder<Float> vector = ImmutableList.builder();
        int length;
        if (value instanceof float[] array) {
            for (float component : array) {
                vector.add(checkComponent(component));
            }
            length = array.length;
        } else if (value instanceof Collection<?> collection) {
            for (Object component : collection) {
                if (!(component instanceof Number number)) {
                    throw new ValidationException(name, "vector component " + describe(component) + " is not a number");
                }
                vector.add(checkComponent(number.floatValue()));
            }
            length = collection.size();
        } else {
            throw new ValidationException(name, "expected a float vector but got " + describe(value));
        }

        if (length != dimension) {
            throw new ValidationException(name, "vector dimension mismatch: expected " + dimension + ", got " + length);
        }
        return vector.build();
    }

    private Float checkComponent(float component) {
        if (!Float.isFinite(component)) {
            throw new ValidationException(name, "vector components must be finite but got " + component);
        }
        return component;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type.storageType());
        if (maxLength != null) {
            sb.append('(').append(maxLength).append(')');
        }
        if (dimension != null) {
            sb.append('[').append(dimension).append(']');
        }
        if (primaryKey) {
            sb.append(autoId ? " PRIMARY KEY AUTO" : " PRIMARY KEY");
        }
        return sb.toString();
    }

    /**
     * Declares a field. {@link #build()} checks the declaration.
     */
    public static final class Builder<T> {
        private final String name;
        private final FieldType type;
        private Integer maxLength;
        private Integer dimension;
        private boolean nullable;
        private boolean primaryKey;
        private boolean autoId;
        private String metric;
        private String description = "";
        private T defaultValue;

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder<T> primaryKey() {
            this.primaryKey = true;
            return this;
        }

        /**
         * Primary key values are generated by the store.
         */
        public Builder<T> autoId() {
            this.autoId = true;
            return this;
        }

        public Builder<T> nullable() {
            this.nullable = true;
            return this;
        }

        public Builder<T> defaultValue(T defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder<T> metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder<T> description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Field<T> build() {
            if (name == null || !NAME_PATTERN.matcher(name).matches()) {
                throw new SchemaException("Invalid field name '" + name + "'");
            }
            if (DISTANCE.equals(name)) {
                throw new SchemaException("Field name '" + DISTANCE + "' is reserved for search distances");
            }
            if (type == FieldType.VARCHAR && (maxLength == null || maxLength < 1 || maxLength > MAX_VARCHAR_LENGTH)) {
                throw new SchemaException("Field '" + name + "': max_length must be between 1 and "
                        + MAX_VARCHAR_LENGTH + " but was " + maxLength);
            }
            if (type == FieldType.FLOAT_VECTOR) {
                if (dimension == null || dimension < 1 || dimension > MAX_DIMENSION) {
                    throw new SchemaException("Field '" + name + "': dimension must be between 1 and "
                            + MAX_DIMENSION + " but was " + dimension);
                }
                if (metric == null || metric.isBlank()) {
                    throw new SchemaException("Field '" + name + "': metric cannot be blank");
                }
                if (nullable) {
                    throw new SchemaException("Field '" + name + "': vector fields cannot be nullable");
                }
            } else if (metric != null) {
                throw new SchemaException("Field '" + name + "': only vector fields take a metric");
            }
            if (primaryKey) {
                if (type != FieldType.INT64 && type != FieldType.VARCHAR) {
                    throw new SchemaException("Field '" + name + "': primary key must be Int64 or VarChar, not "
                            + type.storageType());
                }
                if (nullable) {
                    throw new SchemaException("Field '" + name + "': primary key cannot be nullable");
                }
            }
            if (autoId && (!primaryKey || type != FieldType.INT64)) {
                throw new SchemaException("Field '" + name + "': auto_id requires an Int64 primary key");
            }
            return new Field<>(this);
        }
    }
}
