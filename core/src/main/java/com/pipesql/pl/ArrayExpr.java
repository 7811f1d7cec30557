package com.pipesql.pl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record ArrayExpr(List<Expr> items, SourceSpan span) implements Expr {

    public ArrayExpr {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(span, "span must not be null");
        items = List.copyOf(items);
    }

    @Override
    public String toString() {
        return items.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
