package com.vectororm.orm.expression;

/**
 * Node of a predicate tree: a {@link Comparison} leaf, an AND/OR {@link Junction}
 * or a {@link Negation}. Trees are immutable; combining returns new nodes.
 */
public sealed interface Condition permits Comparison, Junction, Negation {

    default Condition and(Condition other) {
        return new Junction(Connective.AND, this, other);
    }

    default Condition or(Condition other) {
        return new Junction(Connective.OR, this, other);
    }

    default Condition negate() {
        return new Negation(this);
    }
}
