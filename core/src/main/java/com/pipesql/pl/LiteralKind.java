package com.pipesql.pl;

/**
 * Kind of a literal value as written in source.
 */
public enum LiteralKind {
    NULL,
    INTEGER,
    FLOAT,
    BOOLEAN,
    STRING,
    DATE,
    TIME,
    TIMESTAMP
}
