package com.pipesql.rq;

import java.util.Objects;

/**
 * Introduces a computed column. Windowed computes are evaluated over the
 * enclosing {@link Relation.Window}'s partition, order and frame.
 */
public record Compute(ColumnId id, RqExpr expr, boolean windowed) {

    public Compute {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    public static Compute of(ColumnId id, RqExpr expr) {
        return new Compute(id, expr, false);
    }
}
