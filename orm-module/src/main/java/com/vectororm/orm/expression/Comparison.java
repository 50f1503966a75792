package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;
import com.vectororm.orm.field.Field;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Leaf of a predicate tree: {@code field operator operand}.
 * Membership operands are copied into an unmodifiable list.
 */
public record Comparison(String field, Operator operator, Object operand) implements Condition {

    public Comparison {
        if (field == null || field.isBlank()) {
            throw new CompileException("Comparison requires a field name");
        }
        if (operator == null) {
            throw new CompileException("Comparison on '" + field + "' requires an operator");
        }
        if (operand == null) {
            throw new CompileException("Comparison on '" + field + "' cannot use a null operand");
        }
        if (operator == Operator.DISTANCE_LT && !Field.DISTANCE.equals(field)) {
            throw new CompileException("Distance comparisons apply only to '" + Field.DISTANCE + "'");
        }
        if (operator == Operator.IN) {
            if (!(operand instanceof Collection<?> values)) {
                throw new CompileException("Membership on '" + field + "' requires a collection operand");
            }
            List<Object> copy = new ArrayList<>(values.size());
            for (Object value : values) {
                if (value == null) {
                    throw new CompileException("Membership on '" + field + "' cannot contain null");
                }
                copy.add(value);
            }
            operand = Collections.unmodifiableList(copy);
        }
        if (operator.isPattern() && !(operand instanceof String)) {
            throw new CompileException("Operator " + operator + " on '" + field + "' requires a string operand");
        }
    }
}
