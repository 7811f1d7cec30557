package com.pipesql.pl;

import java.util.Objects;

/**
 * A function parameter. The kind is null when not annotated. Parameters with
 * a default value are bound by name at call sites.
 */
public record Param(String name, ParamKind kind, Expr defaultValue) {

    public Param {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Param of(String name) {
        return new Param(name, null, null);
    }

    public static Param of(String name, ParamKind kind) {
        return new Param(name, kind, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
