package com.pipesql.pl;

import java.util.Locale;

/**
 * Declared kind of a function parameter ({@code x <column>}).
 */
public enum ParamKind {
    SCALAR,
    COLUMN,
    RELATION,
    FUNCTION;

    /**
     * Parses a kind annotation such as {@code relation} or {@code func}.
     *
     * @return the kind, or null when the name is not a known kind
     */
    public static ParamKind fromAnnotation(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "scalar" -> SCALAR;
            case "column" -> COLUMN;
            case "relation", "table" -> RELATION;
            case "func", "function" -> FUNCTION;
            default -> null;
        };
    }
}
