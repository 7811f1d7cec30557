package com.pipesql.pl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A tuple {@code {a, b = expr}}. Aliased fields are {@link Assign} nodes.
 */
public record TupleExpr(List<Expr> fields, SourceSpan span) implements Expr {

    public TupleExpr {
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(span, "span must not be null");
        fields = List.copyOf(fields);
    }

    @Override
    public String toString() {
        return fields.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
