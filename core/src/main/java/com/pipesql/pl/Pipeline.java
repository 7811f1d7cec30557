package com.pipesql.pl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered sequence of steps. The value of each step is passed as the last
 * positional argument of the next one.
 */
public record Pipeline(List<Expr> steps, SourceSpan span) implements Expr {

    public Pipeline {
        Objects.requireNonNull(steps, "steps must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("pipeline must have at least one step");
        }
        steps = List.copyOf(steps);
    }

    @Override
    public String toString() {
        return steps.stream().map(Object::toString).collect(Collectors.joining(" | ", "(", ")"));
    }
}
