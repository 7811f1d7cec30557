package com.pipesql.pl;

import java.util.Objects;

public record UnaryExpr(UnaryOperator operator, Expr operand, SourceSpan span) implements Expr {

    public UnaryExpr {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public String toString() {
        return operator.symbol() + operand;
    }
}
