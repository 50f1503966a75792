package com.vectororm.orm.expression;

public enum Connective {
    AND("and"),
    OR("or");

    private final String keyword;

    Connective(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
