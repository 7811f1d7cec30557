package com.pipesql.pl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed program: declarations in source order followed by an optional
 * main pipeline.
 */
public record Query(List<Declaration> declarations, Expr main) {

    public Query {
        Objects.requireNonNull(declarations, "declarations must not be null");
        declarations = List.copyOf(declarations);
    }

    public Optional<Expr> mainPipeline() {
        return Optional.ofNullable(main);
    }
}
