package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;

public record Junction(Connective connective, Condition left, Condition right) implements Condition {

    public Junction {
        if (connective == null || left == null || right == null) {
            throw new CompileException("Junction requires a connective and two operands");
        }
    }
}
