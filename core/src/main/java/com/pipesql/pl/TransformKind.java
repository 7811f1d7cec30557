package com.pipesql.pl;

import java.util.Arrays;
import java.util.Optional;

/**
 * Standard relational transforms. A {@link FuncCall} whose callee names one
 * of these (and is not shadowed by a user definition) is a transform step.
 */
public enum TransformKind {
    FROM("from"),
    SELECT("select"),
    DERIVE("derive"),
    FILTER("filter"),
    AGGREGATE("aggregate"),
    SORT("sort"),
    TAKE("take"),
    JOIN("join"),
    GROUP("group"),
    WINDOW("window"),
    APPEND("append");

    private final String keyword;

    TransformKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<TransformKind> lookup(String name) {
        return Arrays.stream(values()).filter(k -> k.keyword.equals(name)).findFirst();
    }
}
