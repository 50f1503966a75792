package com.vectororm.orm.expression;

import com.vectororm.orm.exception.CompileException;

import java.util.Locale;

/**
 * Closed set of comparison operators with their lookup names ({@code title__contains})
 * and the symbol rendered into the filter expression.
 */
public enum Operator {
    EQ("exact", "=="),
    NE("ne", "!="),
    GT("gt", ">"),
    LT("lt", "<"),
    GTE("gte", ">="),
    LTE("lte", "<="),
    CONTAINS("contains", "like"),
    STARTS_WITH("startswith", "like"),
    ENDS_WITH("endswith", "like"),
    IN("in", "in"),
    DISTANCE_LT("lt", "<");

    private final String lookup;
    private final String symbol;

    Operator(String lookup, String symbol) {
        this.lookup = lookup;
        this.symbol = symbol;
    }

    public String lookup() {
        return lookup;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPattern() {
        return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
    }

    public boolean isOrdering() {
        return this == GT || this == LT || this == GTE || this == LTE;
    }

    /**
     * Resolves a lookup suffix for a regular field. {@code eq} is accepted as an alias of {@code exact}.
     */
    public static Operator fromLookup(String lookup) {
        String normalised = lookup.toLowerCase(Locale.ROOT);
        if ("eq".equals(normalised)) {
            return EQ;
        }
        for (Operator operator : values()) {
            if (operator != DISTANCE_LT && operator.lookup.equals(normalised)) {
                return operator;
            }
        }
        throw new CompileException("Unsupported lookup '" + lookup + "'");
    }
}
