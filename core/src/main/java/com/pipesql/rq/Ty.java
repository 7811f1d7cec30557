package com.pipesql.rq;

/**
 * Inferred value type of an expression.
 *
 * <p>Inference is shallow: literals and operators have known types, table
 * columns are {@link #UNKNOWN} unless computed from typed expressions.
 */
public enum Ty {
    INT,
    FLOAT,
    /** Result of arithmetic on operands whose exact numeric type is unknown. */
    NUMBER,
    BOOL,
    TEXT,
    DATE,
    TIME,
    TIMESTAMP,
    NULL,
    UNKNOWN;

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == NUMBER;
    }

    /**
     * Returns whether a value of this type may stand where a boolean is
     * required.
     */
    public boolean canBeBoolean() {
        return this == BOOL || this == NULL || this == UNKNOWN;
    }

    /**
     * Returns whether a value of this type may take part in arithmetic.
     */
    public boolean canBeNumeric() {
        return isNumeric() || this == NULL || this == UNKNOWN
            || this == DATE || this == TIME || this == TIMESTAMP;
    }

    public String displayName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
