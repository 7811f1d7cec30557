package com.pipesql.pl;

import java.util.Arrays;

/**
 * Infix operators, listed with their source symbol.
 */
public enum BinaryOperator {
    MUL("*"),
    DIV("/"),
    INT_DIV("//"),
    MOD("%"),
    ADD("+"),
    SUB("-"),
    EQ("=="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    REGEX_MATCH("~="),
    COALESCE("??"),
    AND("&&"),
    OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return this == MUL || this == DIV || this == INT_DIV || this == MOD
            || this == ADD || this == SUB;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == GT || this == GTE
            || this == LT || this == LTE || this == REGEX_MATCH;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * Looks up an operator by its source symbol.
     *
     * @throws IllegalArgumentException if no operator uses the symbol
     */
    public static BinaryOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
            .filter(op -> op.symbol.equals(symbol))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
    }
}
