package com.pipesql.rq;

/**
 * Operators of fully resolved expressions.
 */
public enum RqOperator {
    // unary
    NEG,
    NOT,
    IS_NULL,
    IS_NOT_NULL,
    // binary
    MUL,
    DIV,
    INT_DIV,
    MOD,
    ADD,
    SUB,
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,
    REGEX_MATCH,
    AND,
    OR;

    public boolean isUnary() {
        return this == NEG || this == NOT || this == IS_NULL || this == IS_NOT_NULL;
    }
}
