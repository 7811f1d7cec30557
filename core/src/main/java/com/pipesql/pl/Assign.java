package com.pipesql.pl;

import java.util.Objects;

/**
 * An aliased expression, {@code alias = expr}, as found in tuple fields and
 * call arguments.
 */
public record Assign(String alias, Expr value, SourceSpan span) implements Expr {

    public Assign {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public String toString() {
        return alias + " = " + value;
    }
}
