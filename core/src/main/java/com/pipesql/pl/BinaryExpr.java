package com.pipesql.pl;

import java.util.Objects;

public record BinaryExpr(Expr left, BinaryOperator operator, Expr right, SourceSpan span)
        implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public String toString() {
        return "(%s %s %s)".formatted(left, operator.symbol(), right);
    }
}
