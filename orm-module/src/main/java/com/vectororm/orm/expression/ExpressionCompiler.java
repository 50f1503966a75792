package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;
import com.vectororm.orm.field.Field;
import com.vectororm.orm.field.FieldType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Translates predicate trees into Milvus boolean filter expressions.
 * <p>
 * {@link #check} validates a tree against a model's fields, {@link #render} is a pure
 * function of the tree, and {@link #compile} does both after lifting top-level
 * distance bounds out of the tree, since the store cannot filter on them.
 */
@Slf4j
public class ExpressionCompiler {

    /**
     * Validates field references, operand types and distance placement
     * @throws CompileException on the first problem found
     */
    public void check(Condition root, Map<String, Field<?>> fields) {
        if (root != null) {
            check(root, fields, true);
        }
    }

    public CompiledFilter compile(Condition root, Map<String, Field<?>> fields) {
        if (root == null) {
            return CompiledFilter.MATCH_ALL;
        }
        check(root, fields, true);

        List<Double> bounds = new ArrayList<>();
        Condition scalar = stripDistance(root, bounds);
        Double bound = bounds.stream().min(Double::compare).orElse(null);
        CompiledFilter compiled = new CompiledFilter(render(scalar), bound);
        log.trace("Compiled {} into '{}' (distance bound {})", root, compiled.expression(), bound);
        return compiled;
    }

    /**
     * Renders a tree without schema checks. {@code null} renders as the empty expression.
     */
    public String render(Condition root) {
        if (root == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        render(root, out);
        return out.toString();
    }

    /**
     * Renders a single literal: quoted strings, plain-decimal numbers, {@code true}/{@code false}
     * and bracketed lists.
     */
    public String literal(Object value) {
        if (value instanceof String text) {
            return quote(text);
        }
        if (value instanceof Boolean flag) {
            return flag.toString();
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw new CompileException("Cannot render non-finite number " + d);
            }
            // widening a float to double adds spurious digits
            BigDecimal decimal = value instanceof Float f ? new BigDecimal(Float.toString(f)) : BigDecimal.valueOf(d);
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Collection<?> values) {
            StringBuilder out = new StringBuilder("[");
            boolean first = true;
            for (Object element : values) {
                if (!first) {
                    out.append(", ");
                }
                out.append(literal(element));
                first = false;
            }
            return out.append(']').toString();
        }
        throw new CompileException("Cannot render literal of type "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private void check(Condition node, Map<String, Field<?>> fields, boolean topLevelConjunct) {
        if (node instanceof Comparison comparison) {
            checkComparison(comparison, fields, topLevelConjunct);
        } else if (node instanceof Junction junction) {
            boolean conjunct = topLevelConjunct && junction.connective() == Connective.AND;
            check(junction.left(), fields, conjunct);
            check(junction.right(), fields, conjunct);
        } else if (node instanceof Negation negation) {
            check(negation.condition(), fields, false);
        }
    }

    private void checkComparison(Comparison comparison, Map<String, Field<?>> fields, boolean topLevelConjunct) {
        String name = comparison.field();
        Operator operator = comparison.operator();

        if (operator == Operator.DISTANCE_LT) {
            if (!topLevelConjunct) {
                throw new CompileException("Distance bounds can only be AND-combined at the top level of a filter");
            }
            if (!(comparison.operand() instanceof Number bound) || !Double.isFinite(bound.doubleValue())) {
                throw new CompileException("Distance bound must be a finite number");
            }
            return;
        }
        if (Field.DISTANCE.equals(name)) {
            throw new CompileException("Only 'distance__lt' is supported on the distance pseudo-field");
        }

        Field<?> field = fields.get(name);
        if (field == null) {
            throw new CompileException("Unknown field '" + name + "'");
        }
        if (!field.getType().isFilterable()) {
            throw new CompileException("Field '" + name + "' of type " + field.getType().storageType()
                    + " cannot be used in a filter");
        }
        if (operator.isPattern() && field.getType() != FieldType.VARCHAR) {
            throw new CompileException("Operator " + operator + " requires a VarChar field but '" + name + "' is "
                    + field.getType().storageType());
        }
        if (operator.isOrdering() && !field.getType().isOrderable()) {
            throw new CompileException("Field '" + name + "' of type " + field.getType().storageType()
                    + " does not support ordering comparisons");
        }

        if (operator == Operator.IN) {
            for (Object element : (Collection<?>) comparison.operand()) {
                checkOperand(field, element);
            }
        } else {
            checkOperand(field, comparison.operand());
        }
    }

    private void checkOperand(Field<?> field, Object operand) {
        if (!field.getType().acceptsOperand(operand)) {
            throw new CompileException("Operand " + operand + " (" + operand.getClass().getSimpleName()
                    + ") does not match field '" + field.getName() + "' of type " + field.getType().storageType());
        }
        if (operand instanceof Number number && !(operand instanceof BigInteger) && !Double.isFinite(number.doubleValue())) {
            throw new CompileException("Operand for field '" + field.getName() + "' must be finite");
        }
    }

    private Condition stripDistance(Condition node, List<Double> bounds) {
        if (node instanceof Comparison comparison && comparison.operator() == Operator.DISTANCE_LT) {
            bounds.add(((Number) comparison.operand()).doubleValue());
            return null;
        }
        if (node instanceof Junction junction && junction.connective() == Connective.AND) {
            Condition left = stripDistance(junction.left(), bounds);
            Condition right = stripDistance(junction.right(), bounds);
            if (left == null) {
                return right;
            }
            if (right == null) {
                return left;
            }
            return left == junction.left() && right == junction.right() ? junction : new Junction(Connective.AND, left, right);
        }
        return node;
    }

    private void render(Condition node, StringBuilder out) {
        if (node instanceof Comparison comparison) {
            renderComparison(comparison, out);
        } else if (node instanceof Junction junction) {
            renderOperand(junction.left(), junction.connective(), out);
            out.append(' ').append(junction.connective().keyword()).append(' ');
            renderOperand(junction.right(), junction.connective(), out);
        } else if (node instanceof Negation negation) {
            out.append("not (");
            render(negation.condition(), out);
            out.append(')');
        }
    }

    private void renderOperand(Condition child, Connective parent, StringBuilder out) {
        // same-connective chains are associative and stay flat
        if (child instanceof Junction junction && junction.connective() != parent) {
            out.append('(');
            render(child, out);
            out.append(')');
        } else {
            render(child, out);
        }
    }

    private void renderComparison(Comparison comparison, StringBuilder out) {
        out.append(comparison.field()).append(' ').append(comparison.operator().symbol()).append(' ');
        Object operand = comparison.operand();
        switch (comparison.operator()) {
            case CONTAINS -> out.append(quote("%" + escapePattern(operand) + "%"));
            case STARTS_WITH -> out.append(quote(escapePattern(operand) + "%"));
            case ENDS_WITH -> out.append(quote("%" + escapePattern(operand)));
            default -> out.append(literal(operand));
        }
    }

    // like wildcards in the operand match themselves
    private static String escapePattern(Object operand) {
        return operand.toString().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
