package com.pipesql.pl;

import java.util.Objects;

/**
 * {@code let name = expr}: a named relation or constant.
 */
public record VarDef(String name, Expr value, SourceSpan span) implements Declaration {

    public VarDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }
}
