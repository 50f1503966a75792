package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;

public record Negation(Condition condition) implements Condition {

    public Negation {
        if (condition == null) {
            throw new CompileException("Cannot negate a missing condition");
        }
    }
}
