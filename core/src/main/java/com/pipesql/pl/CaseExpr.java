package com.pipesql.pl;

import java.util.List;
import java.util.Objects;

/**
 * {@code case [cond => value, ...]}. The first arm whose condition holds wins.
 */
public record CaseExpr(List<Arm> arms, SourceSpan span) implements Expr {

    public CaseExpr {
        Objects.requireNonNull(arms, "arms must not be null");
        Objects.requireNonNull(span, "span must not be null");
        arms = List.copyOf(arms);
    }

    public record Arm(Expr condition, Expr value) {
        public Arm {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    @Override
    public String toString() {
        return "case " + arms;
    }
}
