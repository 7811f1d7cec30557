package com.pipesql.pl;

import java.util.List;
import java.util.Objects;

/**
 * {@code let name = p1 p2:default <kind> -> body}.
 */
public record FuncDef(String name, List<Param> params, Expr body, SourceSpan span) implements Declaration {

    public FuncDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(span, "span must not be null");
        params = List.copyOf(params);
    }

    /**
     * Returns parameters bound by position, i.e. those without a default.
     */
    public List<Param> positionalParams() {
        return params.stream().filter(p -> !p.hasDefault()).toList();
    }
}
