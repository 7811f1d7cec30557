package com.pipesql.pl;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    /** Arithmetic negation; also descending order inside {@code sort}. */
    NEG("-"),
    /** Explicit ascending order inside {@code sort}; otherwise identity. */
    POS("+"),
    NOT("!"),
    /** Self-equality, {@code ==col}, used by {@code join} to match equal names. */
    SELF_EQ("==");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
